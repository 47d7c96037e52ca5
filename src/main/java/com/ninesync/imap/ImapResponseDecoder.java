package com.ninesync.imap;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.TooLongFrameException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IMAP server response decoder supporting both line-delimited mode and
 * byte-counted literal mode.
 *
 * <p>In <b>line mode</b> (default), splits input on CRLF or LF. A line that
 * ends with a literal announcement {@code {n}} switches the decoder to
 * <b>literal mode</b>, which reads exactly n bytes and then resumes line
 * mode for the remainder of the same response.</p>
 *
 * <p>Each complete response is delivered as one {@link String}. Literals stay
 * inline as {@code {len}CRLF<text>}, where {@code len} is rewritten to the
 * character length of the decoded text so the tokenizer can consume it
 * without knowing the wire encoding.</p>
 */
@Slf4j
public class ImapResponseDecoder extends ByteToMessageDecoder {

    private static final Pattern LITERAL_MARKER = Pattern.compile("\\{(\\d+)\\+?}$");

    private final int maxLineLength;
    private final int maxLiteralLength;

    // Response being assembled across literals
    private final StringBuilder pending = new StringBuilder();
    private boolean assembling = false;

    // Literal mode state
    private int literalBytesRemaining = 0;
    private ByteBuf literalBuffer;

    public ImapResponseDecoder(int maxLineLength, int maxLiteralLength) {
        this.maxLineLength = maxLineLength;
        this.maxLiteralLength = maxLiteralLength;
    }

    /**
     * Decode one message at a time. At most one response is produced per call.
     */
    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (!in.isReadable()) {
            return;
        }
        if (literalBytesRemaining > 0) {
            decodeLiteral(ctx, in);
        } else {
            decodeLine(in, out);
        }
    }

    /**
     * Literal mode: accumulate exactly N bytes, then append them to the pending response.
     */
    private void decodeLiteral(ChannelHandlerContext ctx, ByteBuf in) {
        int toRead = Math.min(literalBytesRemaining, in.readableBytes());

        if (literalBuffer == null) {
            literalBuffer = ctx.alloc().buffer(literalBytesRemaining);
        }

        in.readBytes(literalBuffer, toRead);
        literalBytesRemaining -= toRead;

        if (literalBytesRemaining == 0) {
            String text = literalBuffer.toString(StandardCharsets.UTF_8);
            literalBuffer.release();
            literalBuffer = null;
            appendLiteral(text);
        }
    }

    private void appendLiteral(String text) {
        pending.append('{').append(text.length()).append("}\r\n").append(text);
    }

    /**
     * Line mode: split on CRLF or LF.
     */
    private void decodeLine(ByteBuf in, List<Object> out) {
        int startIndex = in.readerIndex();
        int readableBytes = in.readableBytes();

        for (int i = 0; i < readableBytes; i++) {
            byte b = in.getByte(startIndex + i);
            if (b != '\n') {
                continue;
            }
            boolean hasCR = i > 0 && in.getByte(startIndex + i - 1) == '\r';
            int textLength = hasCR ? i - 1 : i;

            if (textLength > maxLineLength) {
                // Advance past the bad frame so we can recover
                in.readerIndex(startIndex + i + 1);
                resetPending();
                throw new TooLongFrameException(
                        "IMAP response line length (" + textLength + ") exceeds " + maxLineLength);
            }

            String line = textLength > 0
                    ? in.toString(startIndex, textLength, StandardCharsets.UTF_8)
                    : "";
            in.readerIndex(startIndex + i + 1);

            Matcher literal = LITERAL_MARKER.matcher(line);
            if (literal.find()) {
                assembling = true;
                pending.append(line, 0, literal.start());
                String digits = literal.group(1);
                // More than 10 digits cannot fit an int
                long size = digits.length() > 10 ? Long.MAX_VALUE : Long.parseLong(digits);
                if (size > maxLiteralLength) {
                    resetPending();
                    throw new TooLongFrameException(
                            "IMAP literal length (" + digits + ") exceeds " + maxLiteralLength);
                }
                if (size == 0) {
                    appendLiteral("");
                } else {
                    literalBytesRemaining = (int) size;
                }
                return;
            }

            if (assembling) {
                pending.append(line);
                out.add(pending.toString());
                resetPending();
            } else {
                out.add(line);
            }
            return;
        }

        // No complete line yet - check if buffered data already exceeds max
        if (readableBytes > maxLineLength) {
            throw new TooLongFrameException(
                    "IMAP response line length (" + readableBytes + ") exceeds " + maxLineLength);
        }
    }

    private void resetPending() {
        pending.setLength(0);
        assembling = false;
    }

    @Override
    protected void handlerRemoved0(ChannelHandlerContext ctx) {
        if (literalBuffer != null) {
            literalBuffer.release();
            literalBuffer = null;
        }
    }
}
