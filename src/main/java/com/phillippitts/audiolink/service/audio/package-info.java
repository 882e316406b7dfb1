/**
 * Audio format constants and the WAV container codec.
 *
 * <ul>
 *   <li>{@link com.phillippitts.audiolink.service.audio.AudioFormat} - the modem's fixed format
 *       (48 kHz, 16-bit signed PCM, mono, little-endian) and canonical header offsets</li>
 *   <li>{@link com.phillippitts.audiolink.service.audio.WavFormat} - RIFF/WAVE structural constants</li>
 *   <li>{@link com.phillippitts.audiolink.service.audio.WavCodec} - samples to WAV bytes and back</li>
 * </ul>
 */
package com.phillippitts.audiolink.service.audio;
