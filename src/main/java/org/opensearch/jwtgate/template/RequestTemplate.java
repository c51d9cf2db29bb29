/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.template;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.html.HtmlEscapers;
import com.google.common.net.UrlEscapers;

/**
 * A text template with {@code {{ }}} actions that is expanded against the variables of a request.
 * <p>
 * Supported actions:
 * <ul>
 *     <li>{@code {{.Name}}} or {@code {{Name}}} inserts a variable</li>
 *     <li>{@code {{Func .Name}}} applies a function to a variable</li>
 *     <li>{@code {{.Name | Func | Func}}} pipes a variable through functions</li>
 * </ul>
 * Available functions are {@code URLQueryEscape} and {@code HTMLEscape}. Referencing an undefined variable
 * fails the expansion.
 */
public final class RequestTemplate {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    private static final Map<String, UnaryOperator<String>> FUNCTIONS = Map.of(
        "URLQueryEscape",
        UrlEscapers.urlFormParameterEscaper()::escape,
        "HTMLEscape",
        HtmlEscapers.htmlEscaper()::escape
    );

    private static final CharMatcher IDENTIFIER = CharMatcher.inRange('a', 'z')
        .or(CharMatcher.inRange('A', 'Z'))
        .or(CharMatcher.inRange('0', '9'))
        .or(CharMatcher.is('_'));

    private static final Splitter WORDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    @FunctionalInterface
    private interface Expression {
        String evaluate(TemplateVariables variables) throws TemplateException;
    }

    private final String text;
    private final List<Expression> expressions;

    private RequestTemplate(String text, List<Expression> expressions) {
        this.text = text;
        this.expressions = expressions;
    }

    /**
     * Returns true if the text contains action delimiters and should be treated as a template.
     */
    public static boolean isTemplate(String text) {
        return text != null && text.contains(OPEN) && text.contains(CLOSE);
    }

    public static RequestTemplate parse(String text) throws TemplateException {
        ImmutableList.Builder<Expression> expressions = ImmutableList.builder();
        int position = 0;
        while (position < text.length()) {
            int open = text.indexOf(OPEN, position);
            if (open == -1) {
                String literal = text.substring(position);
                expressions.add(variables -> literal);
                break;
            }
            if (open > position) {
                String literal = text.substring(position, open);
                expressions.add(variables -> literal);
            }
            int close = text.indexOf(CLOSE, open + OPEN.length());
            if (close == -1) {
                throw new TemplateException("Unclosed action in template \"" + text + "\"");
            }
            expressions.add(parseAction(text.substring(open + OPEN.length(), close)));
            position = close + CLOSE.length();
        }
        return new RequestTemplate(text, expressions.build());
    }

    private static Expression parseAction(String action) throws TemplateException {
        List<String> commands = Splitter.on('|').splitToList(action);
        Expression expression = null;
        for (String command : commands) {
            List<String> words = WORDS.splitToList(command);
            if (words.isEmpty()) {
                throw new TemplateException("Missing command in action {{" + action + "}}");
            }
            if (expression == null) {
                expression = parseHead(words, action);
            } else if (words.size() == 1) {
                expression = apply(function(words.get(0)), expression);
            } else {
                throw new TemplateException("Too many arguments in action {{" + action + "}}");
            }
        }
        return expression;
    }

    private static Expression parseHead(List<String> words, String action) throws TemplateException {
        if (words.size() == 1) {
            String word = words.get(0);
            if (FUNCTIONS.containsKey(word)) {
                throw new TemplateException("Function " + word + " requires an argument in action {{" + action + "}}");
            }
            return variable(word);
        } else if (words.size() == 2) {
            return apply(function(words.get(0)), variable(words.get(1)));
        } else {
            throw new TemplateException("Too many arguments in action {{" + action + "}}");
        }
    }

    private static Expression variable(String reference) throws TemplateException {
        String name = reference.startsWith(".") ? reference.substring(1) : reference;
        if (name.isEmpty() || !IDENTIFIER.matchesAllOf(name)) {
            throw new TemplateException("Invalid variable reference \"" + reference + "\"");
        }
        return variables -> {
            String value = variables.get(name);
            if (value == null) {
                throw new TemplateException("No value for variable \"" + name + "\"");
            }
            return value;
        };
    }

    private static UnaryOperator<String> function(String name) throws TemplateException {
        UnaryOperator<String> function = FUNCTIONS.get(name);
        if (function == null) {
            throw new TemplateException("Function \"" + name + "\" not defined");
        }
        return function;
    }

    private static Expression apply(UnaryOperator<String> function, Expression argument) {
        return variables -> function.apply(argument.evaluate(variables));
    }

    public String expand(TemplateVariables variables) throws TemplateException {
        StringBuilder result = new StringBuilder(text.length() + 64);
        for (Expression expression : expressions) {
            result.append(expression.evaluate(variables));
        }
        return result.toString();
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
