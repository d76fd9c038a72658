/**
 * Environment-driven settings ({@link com.arbor.config.ArborConfig}): diagram export defaults and message locale.
 */
package com.arbor.config;
