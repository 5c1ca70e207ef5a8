package com.syntaxis.generator.parser;

import com.syntaxis.generator.model.SyntaxVersion;
import com.syntaxis.generator.model.TemplateAst;

/**
 * Turns template text of one dialect into a {@link TemplateAst}.
 */
public interface TemplateParser {

    /**
     * @throws com.syntaxis.generator.exception.TemplateParseException if the text is malformed
     */
    TemplateAst parse(String template);

    SyntaxVersion getSyntaxVersion();
}
