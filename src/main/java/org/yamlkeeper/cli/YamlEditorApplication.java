package org.yamlkeeper.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.yamlkeeper.cli.service.EditCommandService;

/**
 * Command line entry point for editing YAML files in place
 */
@SpringBootApplication
@EnableConfigurationProperties
public class YamlEditorApplication implements ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(YamlEditorApplication.class);

    private int exitCode = EditCommandService.EXIT_OK;

    public static void main(String[] args) {
        // Check for help argument before starting Spring
        if (args.length == 0 || args[0].equals("--help") || args[0].equals("-h")) {
            printUsage();
            System.exit(args.length == 0 ? EditCommandService.EXIT_USAGE : EditCommandService.EXIT_OK);
        }

        SpringApplication app = new SpringApplication(YamlEditorApplication.class);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Prints usage information
     */
    static void printUsage() {
        System.out.println("\nYAML Keeper - format-preserving YAML editor");
        System.out.println("Usage: java -jar yaml-keeper.jar COMMAND FILE [ARGS...] [OPTIONS]");
        System.out.println("\nCommands:");
        System.out.println("  get     FILE PATH                          Print the value at PATH");
        System.out.println("  set     FILE PATH VALUE                    Set PATH to VALUE (read as YAML)");
        System.out.println("  add     FILE PARENT KEY VALUE [COMMENT]    Add KEY under PARENT ('' for the root)");
        System.out.println("  delete  FILE PATH                          Delete PATH and everything below it");
        System.out.println("  comment FILE PATH [TEXT]                   Print or replace the comment above PATH");
        System.out.println("  dump    FILE                               Print the document as it would be saved");
        System.out.println("  inspect FILE                               Print the parsed node list as JSON");
        System.out.println("\nPaths are dot separated, e.g. commands.build.usage or services.0.port");
        System.out.println("\nConfiguration Override Options:");
        System.out.println("  --editor.collapse-literal-block-empty-lines=true   Drop empty lines inside block scalars");
        System.out.println("  --editor.quoting-style=MINIMAL                     Quote changed strings only when required");
        System.out.println("  --editor.charset=ISO-8859-1                        Charset used to read and write files");
        System.out.println("  --editor.print-json=false                          Print values from 'get' as plain text");
        System.out.println("  -h, --help                                         Show this help message");
        System.out.println("\nExamples:");
        System.out.println("  java -jar yaml-keeper.jar set .ahoy.yml commands.build.usage 'Build the site'");
        System.out.println("  java -jar yaml-keeper.jar add .ahoy.yml commands lint \"{usage: Lint, cmd: make lint}\"");
        System.out.println("");
    }

    @Bean
    public CommandLineRunner commandLineRunner(EditCommandService editCommandService) {
        return args -> {
            exitCode = editCommandService.execute(args, System.out, System.err);
            if (exitCode != EditCommandService.EXIT_OK) {
                logger.warn("Command finished with exit code {}", exitCode);
            }
        };
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
