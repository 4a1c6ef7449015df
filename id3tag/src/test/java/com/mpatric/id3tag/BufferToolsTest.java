package com.mpatric.id3tag;

import static com.mpatric.id3tag.TestHelper.bytes;
import static org.junit.Assert.*;

import java.util.Random;

import org.junit.Test;

public class BufferToolsTest {

    @Test
    public void shouldPackAndUnpackSynchsafeIntegers() {
        assertArrayEquals(bytes(0, 0, 1, 0), BufferTools.packSynchsafeInteger(128));
        assertArrayEquals(bytes(0x7f, 0x7f, 0x7f, 0x7f), BufferTools.packSynchsafeInteger(0x0fffffff));
        assertEquals(128, BufferTools.unpackSynchsafeInteger(bytes(0, 0, 1, 0), 0));
        assertEquals(0x0fffffff, BufferTools.unpackSynchsafeInteger(bytes(0x7f, 0x7f, 0x7f, 0x7f), 0));
    }

    @Test
    public void synchsafeRoundTripHoldsBelowTwoToTheTwentyEight() {
        Random random = new Random(42);
        for (int i = 0; i < 1000; i++) {
            int value = random.nextInt(1 << 28);
            for (int width = 4; width <= 6; width++) {
                byte[] packed = BufferTools.packBitPaddedInteger(value, width, BufferTools.SYNCSAFE_BITS);
                assertTrue(BufferTools.hasValidSynchsafePadding(packed, 0, width));
                assertEquals(value, BufferTools.unpackBitPaddedInteger(packed, 0, width, BufferTools.SYNCSAFE_BITS));
            }
        }
    }

    @Test
    public void shouldIgnoreHighBitWhenUnpackingSynchsafe() {
        assertEquals(0x7f, BufferTools.unpackSynchsafeInteger(bytes(0, 0, 0, 0xff), 0));
        assertFalse(BufferTools.hasValidSynchsafePadding(bytes(0, 0, 0, 0xff), 0, 4));
    }

    @Test
    public void shouldPackAndUnpackNormalIntegers() {
        assertArrayEquals(bytes(0, 0, 1, 0), BufferTools.packInteger(256));
        assertEquals(0xffffffffL, BufferTools.unpackInteger(bytes(0xff, 0xff, 0xff, 0xff), 0));
        assertEquals(0x010203, BufferTools.unpackBitPaddedInteger(bytes(1, 2, 3), 0, 3, BufferTools.NORMAL_BITS));
    }

    @Test
    public void shouldStripOnlyTheByteFollowingFF() throws Exception {
        assertArrayEquals(bytes(0xff, 0x00), BufferTools.synchroniseBuffer(bytes(0xff, 0x00, 0x00)));
        assertArrayEquals(bytes(0xff, 0xff), BufferTools.synchroniseBuffer(bytes(0xff, 0x00, 0xff, 0x00)));
        assertArrayEquals(bytes(1, 2, 3), BufferTools.synchroniseBuffer(bytes(1, 2, 3)));
    }

    @Test
    public void shouldKeepTrailingFF() throws Exception {
        assertArrayEquals(bytes(1, 0xff), BufferTools.synchroniseBuffer(bytes(1, 0xff)));
    }

    @Test
    public void shouldKeepFFFollowedByAnythingButZero() {
        assertArrayEquals(bytes(0x01, 0xff, 0xe0, 0x02), BufferTools.synchroniseBuffer(bytes(0x01, 0xff, 0xe0, 0x02)));
        assertArrayEquals(bytes(0xff, 0xd8, 0xff, 0xe0), BufferTools.synchroniseBuffer(bytes(0xff, 0xd8, 0xff, 0xe0)));
    }

    @Test
    public void shouldInsertZeroAfterEveryFF() {
        assertArrayEquals(bytes(0xff, 0x00, 0xe0, 0xff, 0x00), BufferTools.unsynchroniseBuffer(bytes(0xff, 0xe0, 0xff)));
        byte[] untouched = bytes(1, 2, 3);
        assertSame(untouched, BufferTools.unsynchroniseBuffer(untouched));
    }

    @Test
    public void unsynchronisationRoundTripHoldsForRandomData() throws Exception {
        Random random = new Random(7);
        for (int i = 0; i < 200; i++) {
            byte[] data = new byte[random.nextInt(64)];
            random.nextBytes(data);
            // bias towards the interesting bytes
            for (int j = 0; j < data.length; j += 3) {
                data[j] = (byte) 0xff;
            }
            assertArrayEquals(data, BufferTools.synchroniseBuffer(BufferTools.unsynchroniseBuffer(data)));
        }
    }

    @Test
    public void shouldFindTerminatorsAlignedToTheirLength() {
        byte[] data = bytes('a', 0, 'b', 0, 0, 0);
        assertEquals(1, BufferTools.indexOfTerminator(data, 0, data.length, 1));
        // the zero pair at 1..2 straddles a character boundary
        assertEquals(4, BufferTools.indexOfTerminator(bytes('a', 0, 0, 'b', 0, 0), 0, 6, 2));
        assertEquals(-1, BufferTools.indexOfTerminator(bytes('a', 'b'), 0, 2, 1));
    }

    @Test
    public void shouldValidateFrameIds() {
        assertTrue(BufferTools.isValidFrameId(TestHelper.latin1("TIT2"), 0, 4));
        assertFalse(BufferTools.isValidFrameId(TestHelper.latin1("tit2"), 0, 4));
        assertFalse(BufferTools.isValidFrameId(bytes('T', 'I', 'T', 0), 0, 4));
    }

    @Test
    public void shouldReadFixedWidthFields() {
        byte[] field = bytes('a', 'b', ' ', ' ', 0, 'x');
        assertEquals("ab", BufferTools.fixedWidthFieldToString(field, 0, field.length));
        assertEquals("", BufferTools.trimStringRight("   "));
    }

    @Test
    public void shouldTruncateWhenWritingFixedWidthFields() {
        byte[] field = new byte[4];
        BufferTools.stringIntoFixedWidthField("abcdef", field, 0, 4);
        assertArrayEquals(bytes('a', 'b', 'c', 'd'), field);
    }

    @Test
    public void shouldSetAndCheckBits() {
        byte b = BufferTools.setBit((byte) 0, 7, true);
        assertTrue(BufferTools.checkBit(b, 7));
        assertFalse(BufferTools.checkBit(BufferTools.setBit(b, 7, false), 7));
    }
}
