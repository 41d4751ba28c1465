/**
 * API for honeypot persona deployment.
 *
 * <p>Provides interfaces for tools to browse persona templates, deploy
 * them and snapshot filesystem trees for the honeypot runtime.</p>
 *
 * @see me.internalizable.honeymesh.api.persona.PersonaAPI
 */
package me.internalizable.honeymesh.api.persona;
