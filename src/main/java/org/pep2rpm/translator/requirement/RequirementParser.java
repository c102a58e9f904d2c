package org.pep2rpm.translator.requirement;

import org.pep2rpm.translator.MalformedRequirementException;
import org.pep2rpm.translator.marker.ast.MarkerExpression;
import org.pep2rpm.translator.marker.parser.MarkerParser;
import org.pep2rpm.translator.specifier.SpecifierSet;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses PEP 508 requirement strings:
 * <pre>
 *   name [ "[" extra ("," extra)* "]" ] ( "(" specifiers ")" | specifiers | "@" url ) [ ";" marker ]
 * </pre>
 * Specifier and marker syntax errors surface as the exceptions of their own parsers.
 */
public final class RequirementParser {

    private static final Pattern NAME_PATTERN = Pattern.compile(
            "^([A-Za-z0-9](?:[A-Za-z0-9._-]*[A-Za-z0-9])?)");
    private static final Pattern EXTRA_PATTERN = Pattern.compile(
            "[A-Za-z0-9](?:[A-Za-z0-9._-]*[A-Za-z0-9])?");

    private RequirementParser() {
    }

    /**
     * Parses a requirement.
     * @param text The requirement, e.g. {@code requests[socks] (>=2.8) ; python_version < "3.10"}.
     * @return The parsed requirement.
     * @throws MalformedRequirementException if the overall structure is invalid.
     */
    public static Requirement parse(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedRequirementException("Empty requirement", String.valueOf(text));
        }
        String input = text.trim();
        Matcher nameMatcher = NAME_PATTERN.matcher(input);
        if (!nameMatcher.find()) {
            throw new MalformedRequirementException("Expected a project name", text);
        }
        String name = nameMatcher.group(1);
        String rest = input.substring(nameMatcher.end()).stripLeading();

        List<String> extras = List.of();
        if (rest.startsWith("[")) {
            int close = rest.indexOf(']');
            if (close < 0) {
                throw new MalformedRequirementException("Unterminated extras list", text);
            }
            extras = parseExtras(rest.substring(1, close), text);
            rest = rest.substring(close + 1).stripLeading();
        }

        if (rest.startsWith("@")) {
            return parseUrlRequirement(name, extras, rest.substring(1).stripLeading(), text);
        }

        String specifierPart = rest;
        MarkerExpression marker = null;
        int semicolon = rest.indexOf(';');
        if (semicolon >= 0) {
            specifierPart = rest.substring(0, semicolon).trim();
            marker = parseMarker(rest.substring(semicolon + 1), text);
        }
        return new Requirement(name, extras, parseSpecifiers(specifierPart.trim(), text), null, marker);
    }

    private static Requirement parseUrlRequirement(String name, List<String> extras, String rest, String text) {
        int end = 0;
        while (end < rest.length() && !Character.isWhitespace(rest.charAt(end))) {
            end++;
        }
        String url = rest.substring(0, end);
        if (url.isEmpty()) {
            throw new MalformedRequirementException("Expected a URL after '@'", text);
        }
        String tail = rest.substring(end).trim();
        MarkerExpression marker = null;
        if (tail.startsWith(";")) {
            marker = parseMarker(tail.substring(1), text);
        } else if (!tail.isEmpty()) {
            throw new MalformedRequirementException("Unexpected text after URL: '" + tail + "'", text);
        }
        return new Requirement(name, extras, SpecifierSet.EMPTY, url, marker);
    }

    private static List<String> parseExtras(String list, String text) {
        List<String> extras = new ArrayList<>();
        if (list.isBlank()) {
            return extras;
        }
        for (String extra : list.split(",")) {
            String trimmed = extra.trim();
            if (!EXTRA_PATTERN.matcher(trimmed).matches()) {
                throw new MalformedRequirementException("Invalid extra name '" + trimmed + "'", text);
            }
            extras.add(trimmed);
        }
        return extras;
    }

    private static SpecifierSet parseSpecifiers(String part, String text) {
        if (part.startsWith("(")) {
            if (!part.endsWith(")")) {
                throw new MalformedRequirementException("Unbalanced parenthesis around version specifiers", text);
            }
            part = part.substring(1, part.length() - 1);
        }
        return SpecifierSet.parse(part);
    }

    private static MarkerExpression parseMarker(String marker, String text) {
        if (marker.isBlank()) {
            throw new MalformedRequirementException("Expected a marker after ';'", text);
        }
        return MarkerParser.parse(marker.trim());
    }
}
