/**
 * Persona template definitions.
 *
 * <p>Templates describe a honeypot persona: host identity, login accounts,
 * directories, file contents and scripted commands. They are YAML files
 * stored in {@code honeymesh/templates/}.</p>
 *
 * @see me.internalizable.honeymesh.persona.template.TemplateParser
 * @see me.internalizable.honeymesh.persona.template.TemplateLibrary
 */
package me.internalizable.honeymesh.persona.template;
