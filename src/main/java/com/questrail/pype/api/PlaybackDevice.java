package com.questrail.pype.api;

/**
 * Audio output. Each remote participant's stream is played by its own worker.
 */
public interface PlaybackDevice
{
    void play(String source, byte[] chunk);

    void close();
}
