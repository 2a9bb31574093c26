/**
 * Spring configuration: executors, collaborator wiring and typed properties.
 *
 * <p>All tunables are bound from {@code application.properties} through the classes in
 * {@link com.phillippitts.audiofetch.config.properties}.
 */
package com.phillippitts.audiofetch.config;
