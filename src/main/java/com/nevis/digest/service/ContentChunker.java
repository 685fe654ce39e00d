package com.nevis.digest.service;

import com.nevis.digest.model.ChunkDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits markdown-ish text into overlapping chunks for embedding.
 * <p>
 * Blocks are delimited by blank lines and headings and are never split. Token counts are
 * whitespace-run estimates. Spans refer to the normalized input and cover only a chunk's own
 * blocks, not the overlap copied from the previous chunk.
 */
@Component
public class ContentChunker {

    private static final Pattern TOKEN = Pattern.compile("\\S+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public List<ChunkDescriptor> chunk(String content) {
        return chunk(content, ChunkerOptions.defaults());
    }

    public List<ChunkDescriptor> chunk(String content, ChunkerOptions options) {
        String normalized = normalize(content);
        if (normalized.isEmpty()) {
            return List.of();
        }

        List<BaseChunk> baseChunks = pack(segment(normalized), options);
        int chunkCount = baseChunks.size();
        List<ChunkDescriptor> result = new ArrayList<>(chunkCount);

        String previousText = "";
        for (int index = 0; index < chunkCount; index++) {
            BaseChunk chunk = baseChunks.get(index);
            int overlapTokens = 0;
            String overlapText = "";
            if (index > 0 && !previousText.isEmpty()) {
                overlapTokens = clamp(
                    (int) Math.round(chunk.tokenCount() * options.overlapRatio()),
                    options.minOverlapTokens(),
                    options.maxOverlapTokens()
                );
                overlapText = trailingTokens(previousText, overlapTokens);
            }

            String combined = overlapText.isEmpty()
                ? chunk.text()
                : (overlapText.stripTrailing() + "\n\n" + chunk.text()).strip();

            result.add(new ChunkDescriptor(
                index,
                chunkCount,
                combined,
                chunk.start(),
                chunk.end(),
                overlapTokens,
                countWords(combined),
                countTokens(combined)
            ));
            previousText = chunk.text();
        }
        return result;
    }

    static String normalize(String content) {
        if (content == null) {
            return "";
        }
        return content.replace("\r\n", "\n").strip();
    }

    private List<Block> segment(String content) {
        List<Block> blocks = new ArrayList<>();
        String[] lines = content.split("\n", -1);
        StringBuilder buffer = new StringBuilder();
        int bufferStart = 0;
        int cursor = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String lineWithNewline = i < lines.length - 1 ? line + "\n" : line;
            String trimmed = line.strip();
            int lineStart = cursor;
            cursor += lineWithNewline.length();

            boolean heading = trimmed.startsWith("#");
            boolean blank = trimmed.isEmpty();

            if (buffer.length() == 0) {
                bufferStart = lineStart;
            }

            // headings always open a new block, even mid-paragraph
            if (heading && !buffer.toString().isBlank()) {
                flush(buffer, bufferStart, blocks);
                bufferStart = lineStart;
            }

            buffer.append(lineWithNewline);

            if (blank) {
                flush(buffer, bufferStart, blocks);
            }
        }

        flush(buffer, bufferStart, blocks);
        return blocks;
    }

    private void flush(StringBuilder buffer, int bufferStart, List<Block> blocks) {
        String text = buffer.toString();
        buffer.setLength(0);
        if (text.isBlank()) {
            // extra blank lines belong to the preceding block's span so spans stay contiguous
            if (!blocks.isEmpty()) {
                Block last = blocks.remove(blocks.size() - 1);
                blocks.add(new Block(last.text(), last.start(), bufferStart + text.length(), last.tokenCount()));
            }
            return;
        }
        blocks.add(new Block(text.stripTrailing(), bufferStart, bufferStart + text.length(), countTokens(text)));
    }

    private List<BaseChunk> pack(List<Block> blocks, ChunkerOptions options) {
        List<BaseChunk> chunks = new ArrayList<>();
        List<Block> current = new ArrayList<>();
        int currentTokens = 0;

        for (Block block : blocks) {
            if (currentTokens + block.tokenCount() > options.maxTokens() && !current.isEmpty()) {
                emit(current, chunks);
                currentTokens = 0;
            }

            current.add(block);
            currentTokens += block.tokenCount();

            if (currentTokens >= options.targetTokens()) {
                emit(current, chunks);
                currentTokens = 0;
            }
        }

        emit(current, chunks);
        return chunks;
    }

    private void emit(List<Block> current, List<BaseChunk> chunks) {
        if (current.isEmpty()) {
            return;
        }
        String text = String.join("\n\n", current.stream().map(Block::text).toList()).strip();
        if (!text.isEmpty()) {
            chunks.add(new BaseChunk(
                text,
                current.get(0).start(),
                current.get(current.size() - 1).end(),
                countTokens(text)
            ));
        }
        current.clear();
    }

    static int countTokens(String text) {
        Matcher matcher = TOKEN.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    static int countWords(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return WHITESPACE.split(trimmed).length;
    }

    private static String trailingTokens(String text, int budget) {
        if (text.isBlank() || budget <= 0) {
            return "";
        }
        List<Integer> starts = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            starts.add(matcher.start());
        }
        if (starts.isEmpty()) {
            return "";
        }
        int from = starts.get(Math.max(0, starts.size() - budget));
        return text.substring(from).stripLeading();
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private record Block(String text, int start, int end, int tokenCount) {}

    private record BaseChunk(String text, int start, int end, int tokenCount) {}
}
