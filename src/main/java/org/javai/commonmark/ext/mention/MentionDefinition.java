package org.javai.commonmark.ext.mention;

import java.util.regex.Pattern;

/**
 * One validated entry of the {@code mentions} section.
 *
 * @param name the entry's key in the configuration
 * @param prefix the literal text in front of the identifier
 * @param pattern the identifier pattern, compiled case-insensitively
 * @param generator what a match turns into
 */
public record MentionDefinition(String name, String prefix, Pattern pattern, MentionGenerator generator) {
}
