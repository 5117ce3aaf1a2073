package com.questrail.pype.api;

import java.util.function.Consumer;

/**
 * Camera or microphone. The device produces units on its own thread for as long
 * as it is open.
 */
public interface CaptureDevice
{
    /**
     * Start producing units into {@code sink}.
     *
     * @throws IllegalStateException if the device cannot be opened
     */
    void open(Consumer<byte[]> sink);

    void close();
}
