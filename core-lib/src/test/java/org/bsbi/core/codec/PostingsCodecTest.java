package org.bsbi.core.codec;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PostingsCodecTest {

	private static final List<Integer> POSTINGS = List.of(34, 67, 89, 454, 2345738);
	private static final List<Integer> TFS = List.of(12, 10, 3, 4, 1);

	@Test
	public void testRoundTripBothCodecs() throws Exception {
		for (PostingsCodec codec : List.of(new StandardPostingsCodec(), new VbePostingsCodec())) {
			assertEquals(POSTINGS, codec.decodePostings(codec.encodePostings(POSTINGS)), codec.name());
			assertEquals(TFS, codec.decodeTf(codec.encodeTf(TFS)), codec.name());

			assertEquals(List.of(0), codec.decodePostings(codec.encodePostings(List.of(0))), codec.name());
			assertEquals(List.of(Integer.MAX_VALUE),
					codec.decodeTf(codec.encodeTf(List.of(Integer.MAX_VALUE))), codec.name());
		}

		System.out.println("✅ Codec round-trip test passed!");
	}

	@Test
	public void testStandardUsesFourBytesPerValue() throws Exception {
		PostingsCodec codec = new StandardPostingsCodec();

		assertEquals(20, codec.encodePostings(POSTINGS).length);
		assertEquals(20, codec.encodeTf(TFS).length);
		assertThrows(PostingsFormatException.class, () -> codec.decodePostings(new byte[] {1, 2, 3}));
	}

	@Test
	public void testVariableByteLayout() throws Exception {
		// 824 = 6 * 128 + 56, 5 fits in one group
		byte[] encoded = new VbePostingsCodec().encodeTf(List.of(824, 5));

		assertArrayEquals(new byte[] {0x06, (byte) 0xB8, (byte) 0x85}, encoded);
		assertEquals(List.of(824, 5), VbePostingsCodec.decodeNumbers(encoded));
	}

	@Test
	public void testGapsKeepClusteredIdsSmall() {
		VbePostingsCodec codec = new VbePostingsCodec();
		List<Integer> clustered = List.of(1_000_000, 1_000_001, 1_000_003, 1_000_130);

		byte[] encoded = codec.encodePostings(clustered);

		int expected = VbePostingsCodec.encodedWidth(1_000_000)
				+ VbePostingsCodec.encodedWidth(1)
				+ VbePostingsCodec.encodedWidth(2)
				+ VbePostingsCodec.encodedWidth(127);
		assertEquals(expected, encoded.length);
		assertEquals(6, encoded.length);

		int absoluteWidth = clustered.stream().mapToInt(VbePostingsCodec::encodedWidth).sum();
		assertTrue(encoded.length < absoluteWidth);
	}

	@Test
	public void testEncodedWidth() {
		assertEquals(1, VbePostingsCodec.encodedWidth(0));
		assertEquals(1, VbePostingsCodec.encodedWidth(127));
		assertEquals(2, VbePostingsCodec.encodedWidth(128));
		assertEquals(2, VbePostingsCodec.encodedWidth(16383));
		assertEquals(3, VbePostingsCodec.encodedWidth(16384));
		assertEquals(5, VbePostingsCodec.encodedWidth(Integer.MAX_VALUE));
	}

	@Test
	public void testMalformedVariableByteStream() {
		VbePostingsCodec codec = new VbePostingsCodec();

		assertThrows(PostingsFormatException.class, () -> codec.decodeTf(new byte[] {0x06}));
		assertThrows(PostingsFormatException.class,
				() -> codec.decodeTf(new byte[] {0x7F, 0x7F, 0x7F, 0x7F, 0x7F, (byte) 0xFF}));
	}

	@Test
	public void testVariableByteRejectsUnsortedPostings() {
		VbePostingsCodec codec = new VbePostingsCodec();

		assertThrows(IllegalArgumentException.class, () -> codec.encodePostings(List.of(5, 3)));
		assertThrows(IllegalArgumentException.class, () -> codec.encodePostings(List.of(5, 5)));
		assertThrows(IllegalArgumentException.class, () -> codec.encodeTf(List.of(-1)));
	}

	@Test
	public void testEmptyListsDoNotThrow() throws Exception {
		for (PostingsCodec codec : List.of(new StandardPostingsCodec(), new VbePostingsCodec())) {
			assertEquals(0, codec.encodePostings(List.of()).length);
			assertEquals(List.of(), codec.decodePostings(new byte[0]));
			assertEquals(List.of(), codec.decodeTf(new byte[0]));
		}
	}

	@Test
	public void testCodecLookup() {
		assertInstanceOf(VbePostingsCodec.class, PostingsCodecs.forName("VBE"));
		assertInstanceOf(StandardPostingsCodec.class, PostingsCodecs.forName(" standard "));
		assertThrows(IllegalArgumentException.class, () -> PostingsCodecs.forName("gamma"));
	}
}
