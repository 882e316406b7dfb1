/**
 * Application-specific exception hierarchy.
 *
 * <p>Every exception extends {@link com.phillippitts.audiolink.exception.AudioLinkException}
 * and carries an {@link com.phillippitts.audiolink.domain.ErrorKind}; the
 * {@code GlobalExceptionHandler} turns that kind into an HTTP status.
 *
 * <ul>
 *   <li>{@link com.phillippitts.audiolink.exception.InvalidRequestException} - unknown profile or similar</li>
 *   <li>{@link com.phillippitts.audiolink.exception.PayloadTooLargeException} - text over the ceiling</li>
 *   <li>{@link com.phillippitts.audiolink.exception.UploadRejectedException} - empty or oversized upload</li>
 *   <li>{@link com.phillippitts.audiolink.exception.MalformedContainerException} - unreadable WAV</li>
 *   <li>{@link com.phillippitts.audiolink.exception.UnsupportedChannelLayoutException} - non-mono WAV</li>
 *   <li>{@link com.phillippitts.audiolink.exception.ModemException} - timeout, exhaustion, modem failure</li>
 * </ul>
 *
 * <p>The decode path does not throw these across the pipeline boundary: it folds them into a
 * {@link com.phillippitts.audiolink.domain.DecodeResult}.
 */
package com.phillippitts.audiolink.exception;
