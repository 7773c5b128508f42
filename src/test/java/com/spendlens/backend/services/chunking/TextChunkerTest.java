package com.spendlens.backend.services.chunking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class TextChunkerTest {

    private static String statement(int rows, int width) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows; i++) {
            String row = String.format("%02d/01/2024 PAYMENT ROW %05d ", (i % 28) + 1, i);
            StringBuilder line = new StringBuilder(row);
            while (line.length() < width - 12) line.append('X');
            line.append(" 1,234.00 Dr");
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    @Test
    void splitRecords_startsBlockAtDateLinesAndKeepsContinuations() {
        TextChunker chunker = new TextChunker(1000, 0);
        String text = "Statement header\n\n01/01/2024 UPI/ZOMATO 450.00\nORDER 123\n02/01/2024 NEFT SALARY 50000.00 Cr\n";

        List<String> blocks = chunker.splitRecords(text);

        assertEquals(3, blocks.size());
        assertEquals("01/01/2024 UPI/ZOMATO 450.00\nORDER 123", blocks.get(1));
    }

    @Test
    void chunk_fiftyThousandCharsIntoTwoChunksWithOverlap() {
        String text = statement(500, 100);
        assertTrue(text.length() >= 50_000);

        List<TextChunk> chunks = new TextChunker(35_000, 1).chunk(text);

        assertEquals(2, chunks.size());
        for (TextChunk c : chunks) {
            assertTrue(c.text().length() <= 35_000);
        }
        String[] first = chunks.get(0).text().split("\n");
        String lastOfFirst = first[first.length - 1];
        assertTrue(chunks.get(1).text().startsWith(lastOfFirst));
    }

    @Test
    void chunk_neverCutsARecord() {
        List<TextChunk> chunks = new TextChunker(500, 0).chunk(statement(30, 100));

        int rows = 0;
        for (TextChunk c : chunks) {
            for (String line : c.text().split("\n")) {
                assertTrue(line.endsWith("Dr"), "cut row: " + line);
                rows++;
            }
        }
        assertEquals(30, rows);
    }

    private static String serialNumbered(int rows) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= rows; i++) {
            sb.append(String.format("%d  01/04/2024  UPI/DR/4099%06d/RAHUL SHARMA/okaxis  1,250.00  45,000.00", i, i))
                    .append('\n');
        }
        return sb.toString();
    }

    @Test
    void serialNumberedRows_areRecordBoundaries() {
        String text = serialNumbered(700);
        assertTrue(text.length() >= 50_000);

        assertEquals(700, new TextChunker(35_000, 1).splitRecords(text).size());

        List<TextChunk> chunks = new TextChunker(35_000, 1).chunk(text);
        assertEquals(2, chunks.size());
        for (TextChunk c : chunks) {
            assertTrue(c.text().length() <= 35_000, "chunk over budget: " + c.text().length());
        }
    }

    @Test
    void oversizedBlockWithoutDates_isSplitOnLines() {
        StringBuilder sb = new StringBuilder("Statement of account\n");
        for (int i = 0; i < 600; i++) {
            sb.append(String.format("TXN %05d UPI/P2P/RAHUL SHARMA/okaxis PAID 1,250.00 BAL 45,000.00 REF XYZ", i))
                    .append('\n');
        }

        List<TextChunk> chunks = new TextChunker(20_000, 0).chunk(sb.toString());

        assertEquals(3, chunks.size());
        int rows = 0;
        for (TextChunk c : chunks) {
            assertTrue(c.text().length() <= 20_000);
            for (String line : c.text().split("\n")) {
                if (line.startsWith("TXN")) {
                    assertTrue(line.endsWith("REF XYZ"), "cut row: " + line);
                    rows++;
                }
            }
        }
        assertEquals(600, rows);
    }

    @Test
    void overlongLine_isCutByLength() {
        StringBuilder big = new StringBuilder("01/01/2024 ");
        while (big.length() < 300) big.append("LONG NARRATION ");
        String line = big.toString();

        List<TextChunk> chunks = new TextChunker(100, 0).chunk(line + "\n02/01/2024 SHORT 10.00\n");

        StringBuilder rebuilt = new StringBuilder();
        for (TextChunk c : chunks) {
            assertTrue(c.text().length() <= 100);
            for (String piece : c.text().split("\n")) {
                if (!piece.equals("02/01/2024 SHORT 10.00")) rebuilt.append(piece);
            }
        }
        assertEquals(line, rebuilt.toString());
        assertTrue(chunks.get(chunks.size() - 1).text().endsWith("02/01/2024 SHORT 10.00"));
    }

    @Test
    void blankText_noChunks() {
        assertTrue(new TextChunker(100, 1).chunk("  \n ").isEmpty());
    }

    @Test
    void invalidBudget_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(10, -1));
    }
}
