package com.syntaxis.generator.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.syntaxis.generator.exception.ParseErrorKind;
import com.syntaxis.generator.exception.TemplateParseException;
import com.syntaxis.generator.mapping.FeatureMapper;
import com.syntaxis.generator.mapping.LexicalMapper;
import com.syntaxis.generator.mapping.PrefixMatch;
import com.syntaxis.generator.model.Feature;
import com.syntaxis.generator.model.FeatureCategory;
import com.syntaxis.generator.model.FeatureSet;
import com.syntaxis.generator.model.LexicalType;
import com.syntaxis.generator.model.SyntaxVersion;
import com.syntaxis.generator.model.TemplateAst;
import com.syntaxis.generator.model.TemplateGroup;
import com.syntaxis.generator.model.TemplateToken;

/**
 * Parser for the bracket syntax: {@code [article:nom:masc:sg] [noun:sg:nom:masc]}.
 *
 * Every bracket becomes its own single-token group. Features may come in any order;
 * the lexical type decides which categories are required.
 */
public class BracketTemplateParser implements TemplateParser {
    private static final Logger log = LoggerFactory.getLogger(BracketTemplateParser.class);

    private static final Pattern SPAN_PATTERN = Pattern.compile("\\[([^\\]]+)\\]");

    @Override
    public TemplateAst parse(String template) {
        if (template == null || template.isBlank()) {
            throw new TemplateParseException(ParseErrorKind.EMPTY_TEMPLATE, "Template cannot be empty");
        }

        List<TemplateGroup> groups = new ArrayList<>();
        Matcher matcher = SPAN_PATTERN.matcher(template);
        int referenceId = 1;

        while (matcher.find()) {
            groups.add(parseSpan(matcher.group(1), referenceId++));
        }

        if (groups.isEmpty()) {
            throw new TemplateParseException(ParseErrorKind.NO_TOKENS_FOUND,
                    "No valid tokens found in template: " + template);
        }

        log.debug("Parsed bracket template into {} groups", groups.size());
        return new TemplateAst(groups, SyntaxVersion.BRACKET);
    }

    @Override
    public SyntaxVersion getSyntaxVersion() {
        return SyntaxVersion.BRACKET;
    }

    private TemplateGroup parseSpan(String span, int referenceId) {
        String[] parts = span.split(":", -1);
        LexicalType lexicalType = LexicalMapper.resolve(parts[0].trim());

        List<String> featureTokens = Arrays.stream(parts, 1, parts.length)
                .map(String::trim)
                .toList();

        FeatureSet features = parseFeatures(lexicalType, featureTokens);

        return TemplateGroup.builder()
                .token(TemplateToken.builder().lexicalType(lexicalType).build())
                .groupFeatures(features)
                .referenceId(referenceId)
                .build();
    }

    private FeatureSet parseFeatures(LexicalType lexicalType, List<String> tokens) {
        String joined = String.join(":", tokens);

        if (lexicalType.isInvariable()) {
            if (!tokens.isEmpty()) {
                throw new TemplateParseException(ParseErrorKind.UNEXPECTED_FEATURES,
                        "Invariable word " + lexicalType + " should not have features, but got: " + joined);
            }
            return FeatureSet.empty();
        }

        int min = lexicalType.getMinFeatures();
        int max = lexicalType.getMaxFeatures();
        if (tokens.size() < min || tokens.size() > max) {
            String expected = min == max ? "exactly " + min : min + "-" + max;
            throw new TemplateParseException(ParseErrorKind.WRONG_FEATURE_ARITY,
                    lexicalType + " requires " + expected + " features (" + describe(lexicalType) + "), but got "
                            + tokens.size() + ": " + joined);
        }

        List<Feature> features = new ArrayList<>();
        Set<FeatureCategory> seen = EnumSet.noneOf(FeatureCategory.class);
        for (String token : tokens) {
            // Unrecognised values are shape errors here; ambiguity still reports its candidates
            if (FeatureMapper.lookup(token).getKind() == PrefixMatch.Kind.NOT_FOUND) {
                throw new TemplateParseException(ParseErrorKind.INVALID_OR_DUPLICATE_FEATURE,
                        "Invalid or duplicate feature for " + lexicalType + ": " + token);
            }
            Feature feature = FeatureMapper.resolve(token);
            if (!lexicalType.getAllowedCategories().contains(feature.getCategory()) || !seen.add(feature.getCategory())) {
                throw new TemplateParseException(ParseErrorKind.INVALID_OR_DUPLICATE_FEATURE,
                        "Invalid or duplicate feature for " + lexicalType + ": " + token);
            }
            features.add(feature);
        }

        if (!seen.containsAll(lexicalType.getRequiredCategories())) {
            throw new TemplateParseException(ParseErrorKind.INVALID_OR_DUPLICATE_FEATURE,
                    lexicalType + " must have " + describe(lexicalType) + ". Got: " + joined);
        }

        return FeatureSet.of(features);
    }

    private static String describe(LexicalType lexicalType) {
        return lexicalType.getAllowedCategories().stream()
                .sorted()
                .map(category -> lexicalType.getRequiredCategories().contains(category)
                        ? category.getName()
                        : "[" + category.getName() + "]")
                .collect(Collectors.joining(", "));
    }
}
