package com.questrail.pype.api;

import com.questrail.pype.protocol.model.CallInfo;
import com.questrail.pype.protocol.model.Medium;
import com.questrail.pype.protocol.model.UserInfo;
import com.questrail.pype.stats.TrackerSnapshot;

import java.util.List;
import java.util.Map;

/**
 * PresentationListener
 * =============================================================================
 * Outbound callback surface from a peer to its presentation layer.
 *
 * <p>The presentation layer only renders. Every protocol decision has already
 * been made when a callback fires.</p>
 *
 * <h2>Threading</h2>
 * Most callbacks run on the peer's event loop thread.
 * {@link #onRemoteVideoFrame} runs on the video receive worker. Implementations
 * must hand work to their own UI thread and must not block.
 */
public interface PresentationListener
{
    /** The directory accepted our name. Rosters exclude ourselves. */
    void onJoinAccepted(String self, List<UserInfo> users, List<CallInfo> calls);

    /** The name is taken; the user may try another one. */
    void onJoinRejected(String name);

    void onDirectoryChanged(List<UserInfo> users);

    void onCallRosterChanged(List<CallInfo> calls);

    /** {@code caller} is inviting us; answer with a respond command. */
    void onCallPrompt(String caller);

    /** {@code callee} declined, was busy, or went away. Shown as a transient banner. */
    void onCallRejected(String callee);

    void onCallStarted(CallInfo call);

    /** The local session is gone; return to the roster view. */
    void onCallEnded();

    void onRemoteVideoFrame(String source, byte[] frame);

    void onChatMessage(String source, String text);

    void onPeerMediumState(String source, Medium medium, boolean enabled);

    /** Periodic snapshot, per remote participant and medium. */
    void onStatistics(Map<String, Map<Medium, TrackerSnapshot>> statistics);

    /** The directory server connection is gone. */
    void onDisconnected();
}
