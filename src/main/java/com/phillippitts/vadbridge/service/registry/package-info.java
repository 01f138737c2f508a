/**
 * Handle-to-session registry and the reference-counted session record.
 */
package com.phillippitts.vadbridge.service.registry;
