/**
 * Deployable process around the engine: Kafka ingestion of samples, Kafka
 * publication of alerts and trend events, HTTP health, stats and metrics
 * endpoints and environment configuration.
 */
package com.perfwatch.service;
