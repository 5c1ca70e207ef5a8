package com.syntaxis.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.syntaxis.generator.cli.exception.OptionsValidationException;
import com.syntaxis.generator.cli.model.GenerateOptions;
import com.syntaxis.generator.cli.model.ValidatedGenerateOptions;
import com.syntaxis.generator.cli.output.GenerateResultsPrinter;
import com.syntaxis.generator.cli.validation.GenerateOptionsValidator;
import com.syntaxis.generator.core.GenerationJob;
import com.syntaxis.generator.core.GenerationJobResult;
import com.syntaxis.generator.core.GeneratorConfig;
import com.syntaxis.generator.core.JobStatus;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for generating sentences from a grammatical template.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "syntaxis-generator 1.0.0",
        description = "Generates word sequences matching a grammatical template from one or more lexicon files."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    /**
     * Command line whose usage errors (unknown options, unparsable values) exit with
     * the same code as failed option validation.
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new GenerateCommand());
        commandLine.setParameterExceptionHandler((ex, args) -> {
            log.error("{}", ex.getMessage());
            ex.getCommandLine().usage(ex.getCommandLine().getErr());
            return JobStatus.INVALID_INPUT.getExitCode();
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return JobStatus.INVALID_INPUT.getExitCode();
        }

        printer.printBanner(options, validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .template(validated.getTemplate())
                .lexiconFiles(validated.getLexiconFiles())
                .includeArticles(options.isSeedArticles())
                .includePronouns(options.isSeedPronouns())
                .count(options.getCount())
                .seed(options.getSeed())
                .parseOnly(options.isParseOnly())
                .build();

        GenerationJobResult result = new GenerationJob(config).run();

        if (!result.isSuccess()) {
            printer.printFailure(result);
            return result.getStatus().getExitCode();
        }

        printer.printSuccess(options, result);
        return JobStatus.SUCCESS.getExitCode();
    }
}
