/**
 * Detection event model: event kinds, payload records and the borrowed/transferred
 * ownership types that govern payload lifetimes across the callback boundary.
 */
package com.phillippitts.vadbridge.service.event;
