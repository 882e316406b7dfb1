package com.phillippitts.audiolink.exception;

import com.phillippitts.audiolink.domain.ErrorKind;

/**
 * Thrown when an uploaded file is rejected before parsing: empty, or larger than allowed.
 */
public class UploadRejectedException extends AudioLinkException {

    private final long uploadSize;

    private UploadRejectedException(ErrorKind kind, long uploadSize, String message) {
        super(kind, message);
        this.uploadSize = uploadSize;
    }

    public static UploadRejectedException empty() {
        return new UploadRejectedException(ErrorKind.EMPTY_UPLOAD, 0, "Uploaded WAV file was empty.");
    }

    public static UploadRejectedException tooLarge(long uploadSize, long maxBytes) {
        return new UploadRejectedException(ErrorKind.UPLOAD_TOO_LARGE, uploadSize,
                "Uploaded file too large: " + uploadSize + " bytes. Max: " + maxBytes + " bytes");
    }

    public long getUploadSize() {
        return uploadSize;
    }
}
