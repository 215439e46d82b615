/**
 * Server events and the sinks that receive them. Servers never log directly; they
 * report here, and {@link com.questrail.echosrv.observability.Slf4jEchoObservabilitySink}
 * turns events into log lines.
 */
package com.questrail.echosrv.observability;
