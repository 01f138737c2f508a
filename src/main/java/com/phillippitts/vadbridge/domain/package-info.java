/**
 * Immutable domain values shared across the bridge: session states and detection configuration.
 */
package com.phillippitts.vadbridge.domain;
