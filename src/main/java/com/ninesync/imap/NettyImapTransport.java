package com.ninesync.imap;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Netty backed transport. Decoded responses are handed from the event loop
 * to the reading thread through a blocking queue.
 */
@Slf4j
public class NettyImapTransport implements ImapTransport {

    private static final Object CLOSED = new Object();

    private final String host;
    private final int port;
    private final SslContext sslContext;
    private final boolean validateCertificates;
    private final Duration handshakeTimeout;
    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();

    private volatile Channel channel;
    private volatile boolean tlsActive = false;

    private NettyImapTransport(String host, int port, SslContext sslContext,
                               boolean validateCertificates, Duration handshakeTimeout) {
        this.host = host;
        this.port = port;
        this.sslContext = sslContext;
        this.validateCertificates = validateCertificates;
        this.handshakeTimeout = handshakeTimeout;
    }

    /**
     * Connect, optionally with implicit TLS (IMAPS)
     */
    public static NettyImapTransport connect(EventLoopGroup group, String host, int port, boolean implicitTls,
                                             SslContext sslContext, boolean validateCertificates,
                                             Duration connectTimeout, int maxLineLength,
                                             int maxLiteralLength) throws ImapException {
        NettyImapTransport transport = new NettyImapTransport(host, port, sslContext, validateCertificates, connectTimeout);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (implicitTls) {
                            pipeline.addLast("ssl", transport.newSslHandler(ch));
                        }
                        pipeline.addLast("decoder", new ImapResponseDecoder(maxLineLength, maxLiteralLength));
                        pipeline.addLast("handler", transport.new InboundHandler());
                    }
                });

        ChannelFuture future = bootstrap.connect(host, port);
        if (!future.awaitUninterruptibly(connectTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
            future.cancel(true);
            throw ImapException.timeout("Connect to " + host + ":" + port + " timed out");
        }
        if (!future.isSuccess()) {
            throw ImapException.connection("Cannot connect to " + host + ":" + port, future.cause());
        }
        transport.channel = future.channel();

        if (implicitTls) {
            transport.awaitHandshake(transport.channel.pipeline().get(SslHandler.class));
        }
        log.debug("Transport open to {}:{} (tls={})", host, port, transport.tlsActive);
        return transport;
    }

    private SslHandler newSslHandler(Channel ch) {
        SslHandler handler = sslContext.newHandler(ch.alloc(), host, port);
        if (validateCertificates) {
            SSLEngine engine = handler.engine();
            SSLParameters params = engine.getSSLParameters();
            params.setEndpointIdentificationAlgorithm("HTTPS");
            engine.setSSLParameters(params);
        }
        handler.setHandshakeTimeoutMillis(handshakeTimeout.toMillis());
        return handler;
    }

    private void awaitHandshake(SslHandler handler) throws ImapException {
        Future<Channel> handshake = handler.handshakeFuture();
        if (!handshake.awaitUninterruptibly(handshakeTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
            close();
            throw ImapException.timeout("TLS handshake with " + host + " timed out");
        }
        if (!handshake.isSuccess()) {
            close();
            throw ImapException.connection("TLS handshake with " + host + " failed", handshake.cause());
        }
        tlsActive = true;
    }

    @Override
    public void writeLine(String line) throws ImapException {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw ImapException.connection("Connection is closed");
        }
        ChannelFuture write = ch.writeAndFlush(ch.alloc().buffer()
                .writeBytes((line + "\r\n").getBytes(StandardCharsets.UTF_8)));
        write.awaitUninterruptibly();
        if (!write.isSuccess()) {
            throw ImapException.connection("Write failed", write.cause());
        }
    }

    @Override
    public String readLine(Duration timeout) throws ImapException {
        Object item;
        try {
            item = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ImapException.connection("Interrupted while reading", e);
        }
        if (item == null) {
            throw ImapException.timeout("No response within " + timeout.toSeconds() + "s");
        }
        if (item == CLOSED) {
            inbound.offer(CLOSED); // Every later read fails the same way
            throw ImapException.connection("Connection closed by server");
        }
        if (item instanceof Throwable cause) {
            throw ImapException.connection("Connection failed: " + cause.getMessage(), cause);
        }
        return (String) item;
    }

    @Override
    public void startTls() throws ImapException {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw ImapException.connection("Connection is closed");
        }
        SslHandler handler = newSslHandler(ch);
        ch.pipeline().addFirst("ssl", handler);
        awaitHandshake(handler);
    }

    @Override
    public boolean isTlsActive() {
        return tlsActive;
    }

    @Override
    public boolean isOpen() {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    @Override
    public void close() {
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly(5, TimeUnit.SECONDS);
        }
    }

    private class InboundHandler extends SimpleChannelInboundHandler<String> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line) {
            inbound.offer(line);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            log.debug("Connection to {} closed", host);
            inbound.offer(CLOSED);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("IMAP transport error ({}): {}", host, cause.getMessage());
            inbound.offer(cause);
            ctx.close();
        }
    }
}
