/**
 * Encode and decode pipelines orchestrating profile selection, the modem adapter and the WAV codec.
 */
package com.phillippitts.audiolink.service.pipeline;
