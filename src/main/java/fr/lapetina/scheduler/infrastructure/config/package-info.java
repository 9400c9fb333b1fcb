/**
 * YAML configuration of a scheduler replica and its hot-reload loader.
 */
package fr.lapetina.scheduler.infrastructure.config;
