/**
 * Spring configuration: typed properties, executor, model backend, voting strategy and pricing beans.
 */
package com.phillippitts.selfconsistency.config;
