package com.phillippitts.audiolink.presentation.controller;

import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /encode}.
 *
 * @param text    message to encode (may be empty)
 * @param profile optional profile name, e.g. {@code audible-fast}
 */
record EncodeRequest(
        @NotNull(message = "Field 'text' is required.") String text,
        String profile
) {}
