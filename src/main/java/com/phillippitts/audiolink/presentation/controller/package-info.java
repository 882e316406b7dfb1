/**
 * REST controllers: {@code /encode}, {@code /decode}, {@code /profiles} and {@code /health}.
 */
package com.phillippitts.audiolink.presentation.controller;
