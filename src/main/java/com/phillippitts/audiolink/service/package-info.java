/**
 * Application services: WAV codec, modem access, encode/decode pipelines, metrics and health.
 */
package com.phillippitts.audiolink.service;
