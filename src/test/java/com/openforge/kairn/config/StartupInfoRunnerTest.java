package com.openforge.kairn.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StartupInfoRunnerTest {

    @Test
    void maskCredentials_hidesPasswordParameters() {
        assertEquals("jdbc:h2:file:/tmp/ws;PASSWORD=***",
                StartupInfoRunner.maskCredentials("jdbc:h2:file:/tmp/ws;PASSWORD=hunter2"));
        assertEquals("jdbc:postgresql://db/kairn?user=app&password=***&ssl=true",
                StartupInfoRunner.maskCredentials("jdbc:postgresql://db/kairn?user=app&password=s3cret&ssl=true"));
    }

    @Test
    void maskCredentials_hidesUserInfo() {
        assertEquals("jdbc:mysql://***:***@db:3306/kairn",
                StartupInfoRunner.maskCredentials("jdbc:mysql://app:s3cret@db:3306/kairn"));
    }

    @Test
    void maskCredentials_handlesNull() {
        assertEquals("(unknown)", StartupInfoRunner.maskCredentials(null));
    }
}
