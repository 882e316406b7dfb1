/**
 * HTTP presentation layer.
 */
package com.phillippitts.audiolink.presentation;
