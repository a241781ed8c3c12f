/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.voicetutor.config.ThreadPoolConfig} - Queue and backend executors,
 *       plus the scheduler that drives circuit cooldowns</li>
 *   <li>{@link com.phillippitts.voicetutor.config.GenerationBackendConfig} - Placeholder backend
 *       when the application supplies none</li>
 *   <li>{@link com.phillippitts.voicetutor.config.OrchestrationMetricsConfig} - Micrometer gauges
 *       for queues, cache and circuit</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Externalized settings bound from {@code application.properties}</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.voicetutor.config;
