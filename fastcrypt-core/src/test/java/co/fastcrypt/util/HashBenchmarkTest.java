/*
 * This file is part of FastCrypt
 * Copyright (C) 2026 FastCrypt contributors.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */

package co.fastcrypt.util;

import co.fastcrypt.crypto.CryptoException;
import co.fastcrypt.crypto.service.HashService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HashBenchmarkTest {

    @Mock
    private HashService hashService;

    @Test
    void hashesTheBufferTheRequestedNumberOfTimes() {
        when(hashService.getName()).thenReturn("mock");
        when(hashService.sha256(any(byte[].class))).thenReturn(new byte[32]);

        HashBenchmark.Result result = new HashBenchmark(hashService, new Random(1)).run(256, 5);

        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(hashService, times(5)).sha256(captor.capture());
        assertEquals(256, captor.getValue().length);
        assertEquals("mock", result.getLibrary());
        assertEquals(256, result.getDataSize());
        assertEquals(5, result.getIterations());
        assertTrue(result.getDurationNano() >= 0);
        assertTrue(result.getMegabytesPerSecond() >= 0);
    }

    @Test
    void rejectsBadParameters() {
        HashBenchmark benchmark = new HashBenchmark(hashService);
        assertThrows(CryptoException.class, () -> benchmark.run(-1, 1));
        assertThrows(CryptoException.class, () -> benchmark.run(1, 0));
        verifyNoInteractions(hashService);
    }

    @Test
    void throughput() {
        HashBenchmark.Result result = new HashBenchmark.Result("java", 1024 * 1024, 4, 2_000_000_000L);
        assertEquals(2.0, result.getSeconds(), 1e-9);
        assertEquals(2.0, result.getMegabytesPerSecond(), 1e-9);
        assertEquals(0.0, new HashBenchmark.Result("java", 1, 1, 0).getMegabytesPerSecond());
    }
}
