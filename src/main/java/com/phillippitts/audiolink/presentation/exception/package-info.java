/**
 * Maps exceptions to HTTP error responses ({@code detail}, {@code errorCode}, {@code timestamp}).
 */
package com.phillippitts.audiolink.presentation.exception;
