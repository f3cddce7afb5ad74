/**
 * Micrometer integration for unit-of-work counters.
 *
 * @see io.easyrepo.micrometer.MicrometerUnitOfWorkMetrics
 */
package io.easyrepo.micrometer;
