package org.netpreserve.docketcrawl.util.jackson;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentListDeserializerTest {
    @Test
    void splitsLikeAShell() throws IOException {
        assertEquals(List.of("ssh", "-i", "key file", "user@host"),
                ArgumentListDeserializer.split("ssh -i 'key file'   user@host"));
        assertEquals(List.of("--a=\"b\"", ""), ArgumentListDeserializer.split("--a='\"b\"' ''"));
        assertEquals(List.of(), ArgumentListDeserializer.split("   "));
    }

    @Test
    void unterminatedQuote() {
        assertThrows(IOException.class, () -> ArgumentListDeserializer.split("--x 'oops"));
    }
}
