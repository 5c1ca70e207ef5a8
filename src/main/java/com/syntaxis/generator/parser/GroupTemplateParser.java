package com.syntaxis.generator.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.syntaxis.generator.exception.ParseErrorKind;
import com.syntaxis.generator.exception.TemplateParseException;
import com.syntaxis.generator.mapping.LexicalMapper;
import com.syntaxis.generator.model.FeatureSet;
import com.syntaxis.generator.model.LexicalType;
import com.syntaxis.generator.model.SyntaxVersion;
import com.syntaxis.generator.model.TemplateAst;
import com.syntaxis.generator.model.TemplateGroup;
import com.syntaxis.generator.model.TemplateToken;

/**
 * Parser for the grouping syntax.
 *
 * <pre>
 *   (article adj noun{fem})@{nom:masc:sg}   shared features, inline override on noun
 *   (verb)@{present:active:ter:sg}
 *   (article noun)@$1                       inherit the features of group 1
 * </pre>
 *
 * Parsing only: references are recorded as written and checked afterwards by
 * {@link ReferenceValidator}, once the number of groups is known.
 */
public class GroupTemplateParser implements TemplateParser {
    private static final Logger log = LoggerFactory.getLogger(GroupTemplateParser.class);

    private static final Pattern EMPTY_GROUP_PATTERN = Pattern.compile("\\(\\s*\\)@");

    // (tokens)@{features} or (tokens)@$N
    private static final Pattern GROUP_PATTERN = Pattern.compile("\\(([^)]+)\\)@(\\{[^}]+\\}|\\$\\d+)");

    // name or name{features}
    private static final Pattern TOKEN_PATTERN = Pattern.compile("(\\w+)(?:\\{([^}]*)\\})?");

    private final ReferenceValidator referenceValidator;

    public GroupTemplateParser() {
        this(new ReferenceValidator());
    }

    public GroupTemplateParser(ReferenceValidator referenceValidator) {
        this.referenceValidator = referenceValidator;
    }

    @Override
    public TemplateAst parse(String template) {
        if (template == null || template.isBlank()) {
            throw new TemplateParseException(ParseErrorKind.EMPTY_TEMPLATE, "Template cannot be empty");
        }

        String text = template.strip();
        checkDelimiters(text);

        List<TemplateGroup> groups = new ArrayList<>();
        Matcher matcher = GROUP_PATTERN.matcher(text);
        int referenceId = 1;

        while (matcher.find()) {
            groups.add(parseGroup(matcher.group(1), matcher.group(2), referenceId++));
        }

        if (groups.isEmpty()) {
            throw new TemplateParseException(ParseErrorKind.NO_TOKENS_FOUND,
                    "No valid groups found in template: " + text);
        }

        referenceValidator.validate(groups);

        log.debug("Parsed grouping template into {} groups", groups.size());
        return new TemplateAst(groups, SyntaxVersion.GROUPING);
    }

    @Override
    public SyntaxVersion getSyntaxVersion() {
        return SyntaxVersion.GROUPING;
    }

    private void checkDelimiters(String text) {
        if (count(text, '(') != count(text, ')')) {
            throw new TemplateParseException(ParseErrorKind.UNBALANCED_DELIMITERS,
                    "Unclosed group (mismatched parentheses) in template: " + text);
        }
        if (count(text, '{') != count(text, '}')) {
            throw new TemplateParseException(ParseErrorKind.UNBALANCED_DELIMITERS,
                    "Unclosed brace (mismatched braces) in template: " + text);
        }
        if (EMPTY_GROUP_PATTERN.matcher(text).find()) {
            throw new TemplateParseException(ParseErrorKind.EMPTY_GROUP, "Empty group (no tokens specified)");
        }
    }

    private TemplateGroup parseGroup(String tokensText, String suffix, int referenceId) {
        List<TemplateToken> tokens = parseTokens(tokensText, referenceId);
        if (tokens.isEmpty()) {
            throw new TemplateParseException(ParseErrorKind.EMPTY_GROUP,
                    "Empty group (no tokens specified) at group " + referenceId);
        }

        TemplateGroup.TemplateGroupBuilder builder = TemplateGroup.builder()
                .tokens(tokens)
                .referenceId(referenceId);

        if (suffix.startsWith("$")) {
            builder.references(parseReference(suffix));
        } else {
            String features = suffix.substring(1, suffix.length() - 1);
            builder.groupFeatures(FeatureLists.parse(features, "group " + referenceId));
        }

        return builder.build();
    }

    private List<TemplateToken> parseTokens(String tokensText, int referenceId) {
        List<TemplateToken> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(tokensText);

        while (matcher.find()) {
            LexicalType lexicalType = LexicalMapper.resolve(matcher.group(1));
            FeatureSet direct = FeatureLists.parse(matcher.group(2),
                    lexicalType + " in group " + referenceId);
            tokens.add(TemplateToken.builder()
                    .lexicalType(lexicalType)
                    .directFeatures(direct)
                    .build());
        }

        return tokens;
    }

    private static int parseReference(String suffix) {
        try {
            return Integer.parseInt(suffix.substring(1));
        } catch (NumberFormatException e) {
            // Too large for an int, so certainly past the last group.
            return Integer.MAX_VALUE;
        }
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }
}
