package com.mpatric.id3tag;

import static com.mpatric.id3tag.TestHelper.bytes;
import static com.mpatric.id3tag.TestHelper.concat;
import static com.mpatric.id3tag.TestHelper.frame;
import static com.mpatric.id3tag.TestHelper.latin1;
import static com.mpatric.id3tag.TestHelper.textPayload;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.zip.Deflater;

import org.junit.Test;

public class ID3v2TagsTest {

    private static ID3v2Tags read(byte[] tag) throws Exception {
        return read(tag, new ID3v2Tags());
    }

    private static ID3v2Tags read(byte[] tag, ID3v2Tags tags) throws Exception {
        ID3v2Header header = ID3v2Header.parse(tag, 0);
        tags.readFrames(BufferTools.copyBuffer(tag, ID3v2Header.HEADER_LENGTH, tag.length - ID3v2Header.HEADER_LENGTH), header);
        return tags;
    }

    private static byte[] deflate(byte[] data) {
        Deflater deflater = new Deflater();
        deflater.setInput(data);
        deflater.finish();
        byte[] buffer = new byte[data.length + 64];
        int length = deflater.deflate(buffer);
        deflater.end();
        return BufferTools.copyBuffer(buffer, 0, length);
    }

    private static String repeat(char c, int count) {
        char[] chars = new char[count];
        Arrays.fill(chars, c);
        return new String(chars);
    }

    @Test
    public void shouldReadUtf8TitleFromVersionFourTag() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(4, frame(4, "TIT2", textPayload(TextEncoding.UTF_8, "Test Title"))));
        assertEquals(4, tags.getMajorVersion());
        assertNull("frames stay undecoded until requested", tags.get("TIT2"));
        assertEquals(Collections.singletonList("Test Title"), tags.getDecoded("TIT2").getTextValues());
        assertEquals(Collections.singletonList("Test Title"), tags.get("TIT2").getTextValues());
    }

    @Test
    public void commentsWithDifferentDescriptionsGetSeparateSlots() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(3,
                frame(3, "COMM", concat(bytes(0), latin1("eng"), latin1("d1"), bytes(0), latin1("first"))),
                frame(3, "COMM", concat(bytes(0), latin1("eng"), latin1("d2"), bytes(0), latin1("second")))));
        assertEquals(Arrays.asList("COMM:d1:eng", "COMM:d2:eng"), tags.keys());
        ID3v2CommentFrameData second = (ID3v2CommentFrameData) tags.getDecoded("COMM:d2:eng");
        assertEquals("second", second.getText());
    }

    @Test
    public void repeatedSimpleFramesShareOneSlot() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(4,
                frame(4, "TPE1", textPayload(TextEncoding.ISO_8859_1, "a")),
                frame(4, "TPE1", textPayload(TextEncoding.ISO_8859_1, "b"))));
        assertEquals(1, tags.size());
        assertEquals(2, tags.getAllDecoded("TPE1").size());
    }

    @Test
    public void shouldMapVersionTwoTwoFrames() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(2,
                TestHelper.v22Frame("TT2", concat(bytes(0), latin1("Hello"))),
                TestHelper.v22Frame("COM", concat(bytes(0), latin1("eng"), bytes(0), latin1("note")))));
        assertEquals(2, tags.getMajorVersion());
        assertEquals(Collections.singletonList("Hello"), tags.getDecoded("TIT2").getTextValues());
        assertTrue(tags.containsKey("COMM::eng"));
    }

    @Test
    public void shouldDecodeVersionTwoTwoPictureDirectly() throws Exception {
        byte[] pic = concat(bytes(0), latin1("PNG"), bytes(3), latin1("c"), bytes(0, 1, 2, 3));
        ID3v2Tags tags = read(TestHelper.tag(2, TestHelper.v22Frame("PIC", pic)));
        ID3v2PictureFrameData picture = (ID3v2PictureFrameData) tags.get("APIC:c");
        assertNotNull(picture);
        assertEquals("image/png", picture.getMimeType());
    }

    @Test
    public void unmappedVersionTwoTwoFramesAreKeptAsUnknown() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(2,
                TestHelper.v22Frame("XYZ", bytes(1, 2)),
                TestHelper.v22Frame("TT2", concat(bytes(0), latin1("t")))));
        assertEquals(1, tags.getUnknownFrames().size());
        assertEquals("XYZ", tags.getUnknownFrames().get(0).getId());
        assertArrayEquals(bytes(1, 2), tags.getUnknownFrames().get(0).getData());
        assertTrue(tags.containsKey("TIT2"));
    }

    @Test
    public void shouldSkipVersionThreeExtendedHeader() throws Exception {
        byte[] extended = bytes(0, 0, 0, 6, 0, 0, 0, 0, 0, 0);
        ID3v2Tags tags = read(TestHelper.tag(3, 0x40, extended, frame(3, "TIT2", textPayload(TextEncoding.ISO_8859_1, "x"))));
        assertEquals(Collections.singletonList("x"), tags.getDecoded("TIT2").getTextValues());
    }

    @Test
    public void shouldSkipVersionFourExtendedHeader() throws Exception {
        byte[] extended = bytes(0, 0, 0, 6, 1, 0);
        ID3v2Tags tags = read(TestHelper.tag(4, 0x40, extended, frame(4, "TIT2", textPayload(TextEncoding.ISO_8859_1, "x"))));
        assertEquals(Collections.singletonList("x"), tags.getDecoded("TIT2").getTextValues());
    }

    @Test
    public void shouldKeepVersionWhenExtendedHeaderFillsTheTag() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(3, 0x40, bytes(0, 0, 0, 6, 0, 0, 0, 0, 0, 0)));
        assertEquals(3, tags.getMajorVersion());
        assertEquals(0, tags.getRevision());
        assertTrue(tags.isEmpty());
    }

    @Test
    public void shouldInflateCompressedVersionFourFrame() throws Exception {
        byte[] payload = textPayload(TextEncoding.ISO_8859_1, "compressed text");
        byte[] stored = concat(BufferTools.packSynchsafeInteger(payload.length), deflate(payload));
        ID3v2Tags tags = read(TestHelper.tag(4, frame(4, "TIT2", 0x0009, stored)));
        assertEquals(Collections.singletonList("compressed text"), tags.getDecoded("TIT2").getTextValues());
        assertTrue(tags.getUnknownFrames().isEmpty());
    }

    @Test
    public void shouldInflateCompressedVersionThreeFrame() throws Exception {
        byte[] payload = textPayload(TextEncoding.ISO_8859_1, "old style");
        byte[] stored = concat(BufferTools.packInteger(payload.length), deflate(payload));
        ID3v2Tags tags = read(TestHelper.tag(3, frame(3, "TALB", 0x0080, stored)));
        assertEquals(Collections.singletonList("old style"), tags.getDecoded("TALB").getTextValues());
    }

    @Test
    public void inflateFailureCarriesItsCause() {
        try {
            ID3v2Tags.inflate(bytes(1, 2, 3, 4, 5));
            fail("Expected BadCompressedDataException");
        } catch (BadCompressedDataException e) {
            assertTrue(e.getDetailedMessage(), e.getDetailedMessage().startsWith(
                    "[com.mpatric.id3tag.BadCompressedDataException: Bad compressed frame] caused by [java.util.zip.DataFormatException"));
        }
    }

    @Test
    public void badCompressedFrameBecomesUnknown() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(4,
                frame(4, "TIT2", 0x0009, bytes(0, 0, 0, 5, 1, 2, 3, 4, 5)),
                frame(4, "TPE1", textPayload(TextEncoding.ISO_8859_1, "still read"))));
        assertEquals(1, tags.getUnknownFrames().size());
        assertEquals("TIT2", tags.getUnknownFrames().get(0).getId());
        assertFalse(tags.containsKey("TIT2"));
        assertEquals(Collections.singletonList("still read"), tags.getDecoded("TPE1").getTextValues());
    }

    @Test
    public void encryptedFramesBecomeUnknown() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(4, frame(4, "TIT2", 0x0004, bytes(0x80, 1, 2, 3))));
        assertEquals(1, tags.getUnknownFrames().size());
        assertTrue(tags.isEmpty());

        tags = read(TestHelper.tag(3, frame(3, "TIT2", 0x0040, bytes(0x80, 1, 2, 3))));
        assertEquals(1, tags.getUnknownFrames().size());
    }

    @Test
    public void shouldSynchroniseUnsynchronisedVersionFourFrame() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(4, frame(4, "TIT2", 0x0002, bytes(0, 'a', 0xff, 0x00, 'b'))));
        assertEquals(Collections.singletonList("a\u00ffb"), tags.getDecoded("TIT2").getTextValues());
    }

    @Test
    public void unsynchronisedPictureWithJpegMarkerSurvivesRender() throws Exception {
        byte[] jpeg = bytes(0xff, 0xd8, 0xff, 0xe0, 0x00, 0x10);
        byte[] payload = concat(bytes(0), latin1("image/jpeg"), bytes(0, 3), latin1("cover"), bytes(0), jpeg);
        ID3v2Tags tags = read(TestHelper.tag(4, frame(4, "APIC", 0x0002, BufferTools.unsynchroniseBuffer(payload))));
        assertTrue(tags.getUnknownFrames().isEmpty());
        assertEquals(Collections.singletonList("APIC:cover"), tags.keys());
        assertArrayEquals(jpeg, ((ID3v2PictureFrameData) tags.getDecoded("APIC:cover")).getImageData());

        byte[] rendered = tags.render(4);
        assertArrayEquals(frame(4, "APIC", payload), rendered);
        ID3v2Tags reread = read(TestHelper.tag(4, rendered));
        assertArrayEquals(jpeg, ((ID3v2PictureFrameData) reread.getDecoded("APIC:cover")).getImageData());
    }

    @Test
    public void unsynchronisedFrameKeepsStrayFalseSyncBytes() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(4, frame(4, "PRIV", 0x0002, bytes(1, 0xff, 0x00, 0xff, 0xe0))));
        assertTrue(tags.getUnknownFrames().isEmpty());
        assertArrayEquals(bytes(1, 0xff, 0xff, 0xe0), ((ID3v2BinaryFrameData) tags.getDecoded("PRIV")).getData());
    }

    @Test
    public void shouldStopAtInvalidFrameId() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(4,
                frame(4, "TIT2", textPayload(TextEncoding.ISO_8859_1, "x")),
                latin1("junk data that is not a frame")));
        assertEquals(Collections.singletonList("TIT2"), tags.keys());
    }

    @Test
    public void shouldStopAtOversizedFrame() throws Exception {
        byte[] oversized = concat(latin1("TPE1"), BufferTools.packSynchsafeInteger(100), bytes(0, 0), bytes(0, 'a'));
        ID3v2Tags tags = read(TestHelper.tag(4, frame(4, "TIT2", textPayload(TextEncoding.ISO_8859_1, "x")), oversized));
        assertEquals(Collections.singletonList("TIT2"), tags.keys());
    }

    @Test
    public void shouldStopAtPadding() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(3, frame(3, "TIT2", textPayload(TextEncoding.ISO_8859_1, "x")), new byte[100]));
        assertEquals(1, tags.size());
    }

    @Test
    public void shouldReadVersionFourFramesWithPlainSizes() throws Exception {
        String title = repeat('t', 199);
        String artist = repeat('a', 199);
        ID3v2Tags tags = read(TestHelper.tag(4,
                TestHelper.frameWithPlainSize("TIT2", textPayload(TextEncoding.ISO_8859_1, title)),
                TestHelper.frameWithPlainSize("TPE1", textPayload(TextEncoding.ISO_8859_1, artist)),
                new byte[32]));
        assertEquals(Collections.singletonList(title), tags.getDecoded("TIT2").getTextValues());
        assertEquals(Collections.singletonList(artist), tags.getDecoded("TPE1").getTextValues());
    }

    @Test
    public void undecodableFrameStaysAndIsWrittenVerbatim() throws Exception {
        byte[] badComment = bytes(7, 'e', 'n', 'g', 'x');
        ID3v2Tags tags = read(TestHelper.tag(4, frame(4, "COMM", badComment)));
        assertTrue(tags.containsKey("COMM"));
        assertTrue(tags.getAllDecoded("COMM").isEmpty());
        assertNull(tags.getDecoded("COMM"));
        assertTrue(tags.valuesDecoded().isEmpty());
        assertArrayEquals(frame(4, "COMM", badComment), tags.render(4));
    }

    @Test
    public void decodesEachFrameOnlyOnce() throws Exception {
        LazyFrameTest.CountingParser parser = new LazyFrameTest.CountingParser();
        ID3v2Tags tags = read(TestHelper.tag(4,
                frame(4, "TIT2", textPayload(TextEncoding.ISO_8859_1, "t")),
                frame(4, "TPE1", textPayload(TextEncoding.ISO_8859_1, "a")),
                frame(4, "TXXX", concat(bytes(0), latin1("k"), bytes(0), latin1("v")))), new ID3v2Tags(parser));
        assertEquals(Arrays.asList("TIT2", "TPE1", "TXXX:k"), tags.keys());
        assertEquals(0, parser.parses);
        tags.getDecoded("TIT2");
        tags.getDecoded("TIT2");
        assertEquals(1, parser.parses);
        assertEquals(3, tags.valuesDecoded().size());
        assertEquals(3, tags.valuesDecoded().size());
        assertEquals(3, parser.parses);
        assertEquals(3, tags.values().size());
    }

    @Test
    public void shouldAddSetAndDeleteFrames() {
        ID3v2Tags tags = new ID3v2Tags();
        tags.add(new ID3v2TextFrameData("TIT2", TextEncoding.UTF_8, "one"));
        tags.add(new ID3v2UserTextFrameData(TextEncoding.UTF_8, "k", Collections.singletonList("v")));
        assertEquals(Arrays.asList("TIT2", "TXXX:k"), tags.keys());

        List<ID3v2TextFrameData> replacement = Collections.singletonList(new ID3v2TextFrameData("TIT2", TextEncoding.UTF_8, "two"));
        tags.setAll("TIT2", replacement);
        assertEquals(Collections.singletonList("two"), tags.get("TIT2").getTextValues());
        assertEquals(Arrays.asList("TIT2", "TXXX:k"), tags.keys());

        tags.setAll("TALB", Collections.singletonList(new ID3v2TextFrameData("TALB", TextEncoding.UTF_8, "album")));
        assertEquals(Arrays.asList("TIT2", "TXXX:k", "TALB"), tags.keys());

        tags.setAll("TXXX:foo", Collections.singletonList(
                new ID3v2UserTextFrameData(TextEncoding.UTF_8, "bar", Collections.singletonList("v"))));
        assertEquals(Arrays.asList("TIT2", "TXXX:k", "TALB", "TXXX:foo"), tags.keys());
        assertEquals(1, tags.getAll("TXXX:foo").size());
        assertTrue(tags.getAll("TXXX:bar").isEmpty());
        tags.deleteAll("TXXX:foo");

        tags.deleteAll("TXXX:k");
        assertFalse(tags.containsKey(HashKey.of("TXXX", "k")));
        assertEquals(2, tags.size());
        assertTrue(tags.getAll("TXXX:k").isEmpty());
        assertNull(tags.get("missing"));
    }

    @Test
    public void renderPassesUndecodedFramesThroughAndAppendsNewOnes() throws Exception {
        byte[] title = frame(4, "TIT2", textPayload(TextEncoding.UTF_8, "Title"));
        ID3v2Tags tags = read(TestHelper.tag(4, title, new byte[20]));
        tags.add(new ID3v2TextFrameData("TALB", TextEncoding.ISO_8859_1, "Album"));
        assertArrayEquals(concat(title, frame(4, "TALB", textPayload(TextEncoding.ISO_8859_1, "Album"))), tags.render(4));
    }

    @Test
    public void renderUsesPlainSizesForVersionThree() {
        ID3v2Tags tags = new ID3v2Tags();
        tags.add(new ID3v2BinaryFrameData("PRIV", new byte[200]));
        byte[] rendered = tags.render(3);
        assertArrayEquals(bytes(0, 0, 0, 200), BufferTools.copyBuffer(rendered, 4, 4));
        assertArrayEquals(bytes(0, 0, 1, 0x48), BufferTools.copyBuffer(tags.render(4), 4, 4));
    }

    @Test
    public void renderLeavesOutUnknownFrames() throws Exception {
        ID3v2Tags tags = read(TestHelper.tag(4, frame(4, "TIT2", 0x0004, bytes(1, 2, 3))));
        assertEquals(1, tags.getUnknownFrames().size());
        assertEquals(0, tags.render(4).length);
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldNotRenderVersionTwoTwo() {
        new ID3v2Tags().render(2);
    }
}
