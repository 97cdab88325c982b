/*
 * Copyright 2022 devgianlu
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package xyz.gianlu.euph.profile.backend;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import xyz.gianlu.euph.TestAudio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author devgianlu
 */
public class BackendsTest {

    @Test
    public void testProbePrefersOkio() {
        CompressionBackend backend = Backends.probe();
        assertEquals("okio", backend.name());

        List<CompressionBackend> available = Backends.available();
        assertEquals(2, available.size());
        assertEquals("jdk", available.get(1).name());
    }

    @Test
    public void testRegistry() {
        Backends.unregisterBackend(OkioZlibBackend.class);
        try {
            assertEquals("jdk", Backends.probe().name());

            Backends.registerBackend(0, UnavailableBackend.class);
            assertEquals("jdk", Backends.probe().name());
            Backends.unregisterBackend(UnavailableBackend.class);
        } finally {
            Backends.registerBackend(0, OkioZlibBackend.class);
        }

        assertEquals("okio", Backends.probe().name());
    }

    @Test
    public void testInterop() throws IOException {
        byte[] data = TestAudio.randomBytes(50000, 7);
        Arrays.fill(data, 10000, 40000, (byte) 3);

        CompressionBackend jdk = new JdkZlibBackend();
        CompressionBackend okio = new OkioZlibBackend();
        for (int level = 0; level <= 9; level++) {
            assertArrayEquals(data, okio.inflate(jdk.deflate(data, level)));
            assertArrayEquals(data, jdk.inflate(okio.deflate(data, level)));
            assertArrayEquals(data, okio.inflate(okio.deflate(data, level)));
        }

        assertArrayEquals(new byte[0], jdk.inflate(okio.deflate(new byte[0], 6)));
    }

    @Test
    public void testStrictInflate() throws IOException {
        byte[] data = TestAudio.randomBytes(2000, 8);
        for (CompressionBackend backend : Arrays.asList(new JdkZlibBackend(), new OkioZlibBackend())) {
            byte[] deflated = backend.deflate(data, 6);

            assertThrows(IOException.class, () -> backend.inflate(Arrays.copyOf(deflated, deflated.length - 5)), backend.name());
            assertThrows(IOException.class, () -> backend.inflate(Arrays.copyOf(deflated, deflated.length + 3)), backend.name());

            byte[] garbage = deflated.clone();
            garbage[0] = 0x12;
            assertThrows(IOException.class, () -> backend.inflate(garbage), backend.name());
        }
    }

    @Test
    public void testInflateSession() throws IOException {
        byte[] data = TestAudio.randomBytes(30000, 9);
        byte[] deflated = new OkioZlibBackend().deflate(data, 9);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (InflateSession session = new JdkZlibBackend().openInflater()) {
            for (int off = 0; off < deflated.length; off += 777) {
                assertFalse(session.finished());
                out.write(session.feed(deflated, off, Math.min(777, deflated.length - off)));
            }

            assertTrue(session.finished());
            session.finish();
            assertThrows(IOException.class, () -> session.feed(new byte[]{1}, 0, 1));
        }

        assertArrayEquals(data, out.toByteArray());
    }

    @Test
    public void testInflateSessionTruncated() throws IOException {
        byte[] deflated = new JdkZlibBackend().deflate(TestAudio.randomBytes(1000, 10), 6);
        try (InflateSession session = new InflateSession()) {
            session.feed(deflated, 0, deflated.length / 2);
            assertThrows(IOException.class, session::finish);
        }
    }

    public static final class UnavailableBackend implements CompressionBackend {

        @Override
        public @NotNull String name() {
            return "unavailable";
        }

        @Override
        public boolean isAvailable() {
            return false;
        }

        @Override
        public byte @NotNull [] deflate(byte[] data, int level) {
            throw new UnsupportedOperationException();
        }

        @Override
        public byte @NotNull [] inflate(byte[] data) {
            throw new UnsupportedOperationException();
        }
    }
}
