package org.yamlkeeper.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.CommandLineRunner;
import org.yamlkeeper.cli.service.EditCommandService;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for YamlEditorApplication
 */
@ExtendWith(MockitoExtension.class)
class YamlEditorApplicationTest {

    @Mock
    private EditCommandService editCommandService;

    private YamlEditorApplication application;

    @BeforeEach
    void setUp() {
        application = new YamlEditorApplication();
    }

    @Test
    void exitCodeStartsAtZero() {
        assertEquals(0, application.getExitCode());
    }

    @Test
    void runnerDelegatesToService() throws Exception {
        String[] args = {"get", "config.yml", "server.port"};
        when(editCommandService.execute(eq(args), any(PrintStream.class), any(PrintStream.class)))
                .thenReturn(EditCommandService.EXIT_OK);

        CommandLineRunner runner = application.commandLineRunner(editCommandService);
        runner.run(args);

        verify(editCommandService).execute(eq(args), same(System.out), same(System.err));
        assertEquals(EditCommandService.EXIT_OK, application.getExitCode());
    }

    @Test
    void failureExitCodeIsReported() throws Exception {
        when(editCommandService.execute(any(), any(), any())).thenReturn(EditCommandService.EXIT_FAILURE);

        application.commandLineRunner(editCommandService).run("delete", "config.yml", "missing");

        assertEquals(EditCommandService.EXIT_FAILURE, application.getExitCode());
    }

    @Test
    void usageListsCommands() {
        PrintStream original = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true));
        try {
            YamlEditorApplication.printUsage();
        } finally {
            System.setOut(original);
        }

        String usage = captured.toString();
        for (String command : new String[]{"get", "set", "add", "delete", "comment", "dump", "inspect"}) {
            assertTrue(usage.contains("  " + command + " "), command);
        }
    }
}
