package com.syntaxis.generator.cli.output;

import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.syntaxis.generator.cli.model.GenerateOptions;
import com.syntaxis.generator.cli.model.ValidatedGenerateOptions;
import com.syntaxis.generator.core.GenerationJobResult;
import com.syntaxis.generator.core.GenerationResult;
import com.syntaxis.generator.lexicon.LexicalWord;
import com.syntaxis.generator.model.TemplateAst;
import com.syntaxis.generator.model.TemplateGroup;
import com.syntaxis.generator.model.TemplateToken;
import com.syntaxis.generator.resolver.ResolvedToken;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Syntaxis Template Generator");
        log.info("=================================================");
        log.info("Template: {}", v.getTemplate());

        if (o.isParseOnly()) {
            log.info("Mode: parse only");
        } else {
            log.info("Lexicon Files: {}", v.getLexiconFiles().isEmpty() ? "None" : v.getLexiconFiles());
            log.info("Seed Articles: {}", o.isSeedArticles());
            log.info("Seed Pronouns: {}", o.isSeedPronouns());
            log.info("Count: {}", o.getCount());
            log.info("Random Seed: {}", o.getSeed() != null ? o.getSeed() : "random");
        }

        log.info("=================================================");
    }

    public void printStructure(TemplateAst ast) {
        log.info("");
        log.info("Syntax {} ({}): {} groups, {} tokens", ast.getSyntaxVersion().getNumber(), ast.getSyntaxVersion(),
                ast.getGroups().size(), ast.getTokenCount());
        for (TemplateGroup group : ast.getGroups()) {
            String tokens = group.getTokens().stream()
                    .map(TemplateToken::toString)
                    .collect(Collectors.joining(" "));
            String source = group.getReference()
                    .map(id -> "$" + id)
                    .orElse(group.getGroupFeatures().toString());
            log.info("  Group {}: ({}) @ {}", group.getReferenceId(), tokens, source);
        }
    }

    public void printSuccess(GenerateOptions o, GenerationJobResult result) {
        if (o.isParseOnly()) {
            printStructure(result.getAst());
            log.info("=================================================");
            return;
        }

        log.info("");
        log.info("Lexicon: {} words loaded ({} errors, {} warnings)",
                result.getWordsLoaded(), result.getLexiconErrors(), result.getLexiconWarnings());
        log.info("");

        int index = 1;
        for (GenerationResult generated : result.getResults()) {
            log.info("{}. {}", index++, generated.getSentence());
            if (o.isShowFeatures()) {
                printFeatures(generated);
            }
        }

        result.getResults().stream()
                .findFirst()
                .ifPresent(first -> first.getOverrides().forEach(event -> log.warn(event.describe())));

        log.info("=================================================");
    }

    public void printFailure(GenerationJobResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }

    private void printFeatures(GenerationResult generated) {
        for (int i = 0; i < generated.getTokens().size(); i++) {
            ResolvedToken token = generated.getTokens().get(i);
            LexicalWord word = generated.getWords().get(i);
            log.info("     {} {} -> {} ({})", token.getLexicalType(), token.getFeatures(), word, word.getLemma());
        }
    }
}
