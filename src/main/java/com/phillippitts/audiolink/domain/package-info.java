/**
 * Immutable domain types shared by the pipelines and the modem adapter.
 *
 * <ul>
 *   <li>{@link com.phillippitts.audiolink.domain.Payload} - message bytes</li>
 *   <li>{@link com.phillippitts.audiolink.domain.SampleBuffer} - mono PCM waveform</li>
 *   <li>{@link com.phillippitts.audiolink.domain.TransmissionProfile} - modulation settings</li>
 *   <li>{@link com.phillippitts.audiolink.domain.DecodeResult} - tagged decode outcome</li>
 *   <li>{@link com.phillippitts.audiolink.domain.ErrorKind} - failure classification</li>
 * </ul>
 */
package com.phillippitts.audiolink.domain;
