package com.phillippitts.audiolink.exception;

import com.phillippitts.audiolink.domain.ErrorKind;

/**
 * Thrown when a well-formed WAV container is not mono.
 */
public class UnsupportedChannelLayoutException extends MalformedContainerException {

    private final int channels;

    public UnsupportedChannelLayoutException(int containerSize, int channels) {
        super(ErrorKind.UNSUPPORTED_CHANNEL_LAYOUT, containerSize,
                "unsupported channel count " + channels + ", only mono audio can be decoded");
        this.channels = channels;
    }

    public int getChannels() {
        return channels;
    }
}
