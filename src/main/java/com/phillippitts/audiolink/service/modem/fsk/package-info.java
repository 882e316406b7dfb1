/**
 * In-process sixteen-tone FSK implementation of
 * {@link com.phillippitts.audiolink.service.modem.AcousticModem}.
 *
 * <p>Only {@link com.phillippitts.audiolink.service.modem.fsk.MultiToneFskModem} is public;
 * the detector, frame layout, preamble and accumulator are implementation details.
 */
package com.phillippitts.audiolink.service.modem.fsk;
