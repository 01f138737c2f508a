/**
 * Event dispatch: converts engine signals into {@link com.phillippitts.vadbridge.service.event.VadEvent}s
 * and delivers them to registered callbacks under the payload ownership rules.
 */
package com.phillippitts.vadbridge.service.dispatch;
