/**
 * Honeypot persona deployment.
 *
 * <p>This package turns YAML persona templates into materialized filesystems
 * and snapshot artifacts that a honeypot runtime serves to attackers.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link me.internalizable.honeymesh.persona.PersonaDeployer} - Main orchestrator</li>
 *   <li>{@link me.internalizable.honeymesh.persona.template.TemplateLibrary} - Template discovery and caching</li>
 *   <li>{@link me.internalizable.honeymesh.persona.materialize.TemplateMaterializer} - Template to directory tree</li>
 *   <li>{@link me.internalizable.honeymesh.persona.snapshot.FilesystemSnapshotter} - Directory tree to snapshot artifact</li>
 * </ul>
 *
 * @see me.internalizable.honeymesh.persona.PersonaDeployer
 */
package me.internalizable.honeymesh.persona;
