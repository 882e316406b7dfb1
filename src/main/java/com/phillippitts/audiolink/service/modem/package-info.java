/**
 * Modem access: the {@link com.phillippitts.audiolink.service.modem.AcousticModem} contract,
 * the instance pool, the adapter that drives modulation and timed demodulation, the streaming
 * session, and profile selection.
 *
 * <p>Nothing outside this package holds a modem instance.
 */
package com.phillippitts.audiolink.service.modem;
