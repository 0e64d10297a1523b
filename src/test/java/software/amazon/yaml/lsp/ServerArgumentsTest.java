/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.cli.CliError;
import software.amazon.smithy.cli.CliPrinter;

public class ServerArgumentsTest {
    @Test
    public void usesStandardStreamsByDefault() {
        ServerArguments serverArguments = ServerArguments.create(new String[0]);

        assertEquals(ServerArguments.DEFAULT_PORT, serverArguments.port());
        assertFalse(serverArguments.help());
        assertFalse(serverArguments.useSocket());
    }

    @Test
    public void readsPositionalPort() {
        ServerArguments serverArguments = ServerArguments.create(new String[] {"4389"});

        assertEquals(4389, serverArguments.port());
        assertTrue(serverArguments.useSocket());
    }

    @Test
    public void readsPortFlags() {
        assertEquals(100, ServerArguments.create(new String[] {"-p", "100"}).port());
        assertEquals(65535, ServerArguments.create(new String[] {"--port", "65535"}).port());
    }

    @Test
    public void zeroPortMeansStandardStreams() {
        assertFalse(ServerArguments.create(new String[] {"--port", "0"}).useSocket());
        assertFalse(ServerArguments.create(new String[] {"0"}).useSocket());
    }

    @Test
    public void rejectsOutOfRangePort() {
        CliError error = assertThrows(CliError.class, () -> ServerArguments.create(new String[] {"-p", "65536"}));

        assertThat(error.getMessage(), containsString("expected an integer between 0 and 65535, inclusive"));
        assertThat(error.getMessage(), containsString("Was: 65536"));
    }

    @Test
    public void rejectsNonNumericPort() {
        assertThrows(CliError.class, () -> ServerArguments.create(new String[] {"yaml"}));
    }

    @Test
    public void rejectsUnknownFlag() {
        assertThrows(CliError.class, () -> ServerArguments.create(new String[] {"--stdio"}));
    }

    @Test
    public void readsHelpFlags() {
        assertTrue(ServerArguments.create(new String[] {"-h"}).help());
        assertTrue(ServerArguments.create(new String[] {"--help"}).help());
    }

    @Test
    public void printsUsage() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ServerArguments.printHelp(CliPrinter.fromOutputStream(out));
        String usage = out.toString(StandardCharsets.UTF_8);

        assertThat(usage, containsString("yaml-language-server.jar"));
        assertThat(usage, containsString("--port"));
        assertThat(usage, containsString("--help"));
    }
}
