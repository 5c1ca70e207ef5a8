package com.syntaxis.generator.parser;

import java.util.EnumMap;
import java.util.Map;

import com.syntaxis.generator.exception.ParseErrorKind;
import com.syntaxis.generator.exception.TemplateParseException;
import com.syntaxis.generator.model.SyntaxVersion;
import com.syntaxis.generator.model.TemplateAst;

/**
 * Picks the parser for a template from its first non-blank character.
 */
public class TemplateParsers {

    private final Map<SyntaxVersion, TemplateParser> parsers = new EnumMap<>(SyntaxVersion.class);

    public TemplateParsers() {
        this(new BracketTemplateParser(), new GroupTemplateParser());
    }

    public TemplateParsers(TemplateParser... parsers) {
        for (TemplateParser parser : parsers) {
            this.parsers.put(parser.getSyntaxVersion(), parser);
        }
    }

    /**
     * @throws TemplateParseException {@code EMPTY_TEMPLATE} or {@code INVALID_TEMPLATE_LEAD_CHARACTER}
     */
    public SyntaxVersion detectVersion(String template) {
        String text = template == null ? "" : template.strip();
        if (text.isEmpty()) {
            throw new TemplateParseException(ParseErrorKind.EMPTY_TEMPLATE, "Template cannot be empty");
        }

        char lead = text.charAt(0);
        for (SyntaxVersion version : SyntaxVersion.values()) {
            if (version.getLeadCharacter() == lead) {
                return version;
            }
        }
        throw new TemplateParseException(ParseErrorKind.INVALID_TEMPLATE_LEAD_CHARACTER,
                "Template must start with '[' or '(' but starts with '" + lead + "'");
    }

    public TemplateAst parse(String template) {
        SyntaxVersion version = detectVersion(template);
        TemplateParser parser = parsers.get(version);
        if (parser == null) {
            throw new IllegalStateException("No parser registered for " + version);
        }
        return parser.parse(template.strip());
    }
}
