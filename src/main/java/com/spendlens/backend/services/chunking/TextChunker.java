package com.spendlens.backend.services.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

/**
 * Splits statement text into chunks under a character budget without cutting a record in two.
 *
 * A record block starts at a blank line or at a line that opens with a date, optionally after a
 * row serial number. Blocks are packed greedily; the last {@code overlapRecords} blocks of a
 * chunk are repeated at the start of the next one so a row near a boundary is always seen whole
 * at least once. A block larger than the budget is split into its lines, and a line larger than
 * the budget is cut by length, so no chunk exceeds {@code maxChars}.
 */
@Slf4j
public class TextChunker {

    static final Pattern DATE_ANCHOR = Pattern.compile(
            "^\\s*(?:\\d{1,5}[.)]?\\s+)?(?:\\d{1,2}[/.-]\\d{1,2}[/.-]\\d{2,4}"
                    + "|\\d{1,2}[- ](?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*[- ,]+\\d{2,4}"
                    + "|\\d{4}-\\d{2}-\\d{2}"
                    + "|(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]* \\d{1,2}, \\d{4})\\b",
            Pattern.CASE_INSENSITIVE);

    private final int maxChars;
    private final int overlapRecords;

    public TextChunker(int maxChars, int overlapRecords) {
        if (maxChars <= 0) throw new IllegalArgumentException("maxChars must be positive");
        if (overlapRecords < 0) throw new IllegalArgumentException("overlapRecords must not be negative");
        this.maxChars = maxChars;
        this.overlapRecords = overlapRecords;
    }

    public List<TextChunk> chunk(String text) {
        List<String> blocks = fitToBudget(splitRecords(text));
        List<TextChunk> chunks = new ArrayList<>();
        if (blocks.isEmpty()) return chunks;

        List<String> current = new ArrayList<>();
        int currentLen = 0;
        boolean currentHasNew = false;

        for (String block : blocks) {
            int blockLen = block.length() + 1;

            if (currentHasNew && currentLen + blockLen > maxChars) {
                chunks.add(toChunk(chunks.size(), current));

                List<String> carried = tail(current, overlapRecords);
                int carriedLen = length(carried);
                current = new ArrayList<>();
                currentLen = 0;
                if (carriedLen + blockLen <= maxChars) {
                    current.addAll(carried);
                    currentLen = carriedLen;
                }
                currentHasNew = false;
            }

            current.add(block);
            currentLen += blockLen;
            currentHasNew = true;
        }

        if (currentHasNew) {
            chunks.add(toChunk(chunks.size(), current));
        }

        log.debug("[Chunker] {} record blocks -> {} chunks (maxChars={} overlap={})",
                blocks.size(), chunks.size(), maxChars, overlapRecords);
        return chunks;
    }

    /**
     * Record blocks in document order. Blank lines are dropped.
     */
    public List<String> splitRecords(String text) {
        List<String> blocks = new ArrayList<>();
        if (text == null || text.isBlank()) return blocks;

        StringBuilder current = new StringBuilder();
        for (String line : text.split("\\r?\\n")) {
            if (line.isBlank()) {
                flush(current, blocks);
                continue;
            }
            if (DATE_ANCHOR.matcher(line).find()) {
                flush(current, blocks);
            }
            if (current.length() > 0) current.append('\n');
            current.append(line);
        }
        flush(current, blocks);
        return blocks;
    }

    /**
     * Oversized blocks become one block per line; a line over the budget is cut into pieces.
     */
    List<String> fitToBudget(List<String> blocks) {
        List<String> out = new ArrayList<>(blocks.size());
        int piece = Math.max(1, maxChars - 1);
        for (String block : blocks) {
            if (block.length() + 1 <= maxChars) {
                out.add(block);
                continue;
            }
            for (String line : block.split("\n")) {
                for (int start = 0; start < line.length(); start += piece) {
                    out.add(line.substring(start, Math.min(line.length(), start + piece)));
                }
            }
        }
        return out;
    }

    private static void flush(StringBuilder current, List<String> blocks) {
        if (current.length() == 0) return;
        blocks.add(current.toString());
        current.setLength(0);
    }

    private static TextChunk toChunk(int index, List<String> blocks) {
        return new TextChunk(index, String.join("\n", blocks), blocks.size());
    }

    private static List<String> tail(List<String> blocks, int n) {
        if (n <= 0 || blocks.isEmpty()) return List.of();
        return new ArrayList<>(blocks.subList(Math.max(0, blocks.size() - n), blocks.size()));
    }

    private static int length(List<String> blocks) {
        int len = 0;
        for (String b : blocks) len += b.length() + 1;
        return len;
    }
}
