package cn.edu.bit.vaultsync.handler;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.exception.EnvelopeException;
import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.remote.RemoteEndpoint;
import cn.edu.bit.vaultsync.remote.RemoteFileInfo;
import cn.edu.bit.vaultsync.remote.RemoteFileReader;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpChunkedInput;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.stream.ChunkedStream;

/**
 * 只读的 HTTP 文件服务：目录返回 JSON 列表，文件返回解密后的内容
 * <p>
 * GET /path -> 远端 root/path
 */
public class StreamServerHandler extends SimpleChannelInboundHandler<HttpObject> {
    private static final Logger logger = LoggerFactory.getLogger(StreamServerHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final int STREAM_CHUNK_SIZE = 64 * 1024;

    private final RemoteEndpoint endpoint;
    private final CipherSuite cipherSuite;
    private final String root;
    private final String secret;

    /**
     * 目录列表中的一项
     */
    public record ListingEntry(String name, String path, long size, long mtime, boolean directory) {
    }

    /**
     * @param secret 解密口令，null 时按原样返回远端字节
     */
    public StreamServerHandler(RemoteEndpoint endpoint, CipherSuite cipherSuite, String root, String secret) {
        this.endpoint = endpoint;
        this.cipherSuite = cipherSuite;
        this.root = root.endsWith("/") && root.length() > 1 ? root.substring(0, root.length() - 1) : root;
        this.secret = secret;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, HttpObject msg) throws Exception {
        if (msg instanceof HttpRequest request) {
            handleHttpRequest(ctx, request);
        }
    }

    private void handleHttpRequest(ChannelHandlerContext ctx, HttpRequest request) throws Exception {
        if (!HttpMethod.GET.equals(request.method())) {
            sendError(ctx, HttpResponseStatus.METHOD_NOT_ALLOWED);
            return;
        }
        String path = new QueryStringDecoder(request.uri()).path();
        if (path.contains("/../") || path.endsWith("/..")) {
            sendError(ctx, HttpResponseStatus.FORBIDDEN);
            return;
        }
        String remotePath = resolve(path);

        Optional<RemoteFileInfo> stat;
        try {
            stat = endpoint.stat(remotePath);
        } catch (RemoteException e) {
            sendError(ctx, statusOf(e), e.getRemoteMessage());
            return;
        }
        if (stat.isEmpty()) {
            sendError(ctx, HttpResponseStatus.NOT_FOUND);
            return;
        }
        if (stat.get().directory()) {
            handleList(ctx, request, remotePath);
        } else {
            handleFile(ctx, request, remotePath);
        }
    }

    private void handleList(ChannelHandlerContext ctx, HttpRequest request, String remotePath) throws Exception {
        List<ListingEntry> entries = new ArrayList<>();
        try {
            for (RemoteFileInfo info : endpoint.list(remotePath)) {
                entries.add(new ListingEntry(info.name(), relative(info.path()), info.size(), info.mtimeSeconds(),
                        info.directory()));
            }
        } catch (RemoteException e) {
            sendError(ctx, statusOf(e), e.getRemoteMessage());
            return;
        }
        String json = MAPPER.writeValueAsString(entries);
        sendResponse(ctx, request, HttpResponseStatus.OK, json, "application/json");
    }

    private void handleFile(ChannelHandlerContext ctx, HttpRequest request, String remotePath) throws IOException {
        RemoteFileReader reader;
        try {
            reader = RemoteFileReader.open(endpoint, cipherSuite, remotePath, secret);
        } catch (RemoteException e) {
            sendError(ctx, statusOf(e), e.getRemoteMessage());
            return;
        } catch (EnvelopeException e) {
            logger.warn("Cannot serve {}: {}", remotePath, e.getMessage());
            sendError(ctx, HttpResponseStatus.UNPROCESSABLE_ENTITY, e.getMessage());
            return;
        }
        long totalLength = reader.plainLength();

        ByteRange range = null;
        if (reader.supportsRanges()) {
            range = ByteRange.parse(request.headers().get(HttpHeaderNames.RANGE), totalLength);
        }
        if (range != null && !range.satisfiable()) {
            FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1,
                    HttpResponseStatus.REQUESTED_RANGE_NOT_SATISFIABLE);
            response.headers().set(HttpHeaderNames.CONTENT_RANGE, "bytes */" + totalLength);
            response.headers().set(HttpHeaderNames.CONTENT_LENGTH, 0);
            ctx.writeAndFlush(response);
            return;
        }

        long start = range == null ? 0 : range.start();
        long length = range == null ? totalLength : range.length();
        HttpResponse response = new DefaultHttpResponse(HttpVersion.HTTP_1_1,
                range == null ? HttpResponseStatus.OK : HttpResponseStatus.PARTIAL_CONTENT);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, length);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/octet-stream");
        if (reader.supportsRanges()) {
            response.headers().set(HttpHeaderNames.ACCEPT_RANGES, HttpHeaderValues.BYTES);
        }
        if (range != null) {
            response.headers().set(HttpHeaderNames.CONTENT_RANGE,
                    "bytes " + range.start() + "-" + range.end() + "/" + totalLength);
        }
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        }

        logger.debug("Serving {} bytes of {} from {}", length, remotePath, start);
        InputStream content = reader.openStream(start, length);
        ctx.write(response);
        ChannelFuture future = ctx.writeAndFlush(new HttpChunkedInput(new ChunkedStream(content, STREAM_CHUNK_SIZE)));
        if (!keepAlive) {
            future.addListener(ChannelFutureListener.CLOSE);
        }
    }

    private String resolve(String path) {
        if (path.isEmpty() || "/".equals(path)) {
            return root;
        }
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        return "/".equals(root) ? trimmed : root + trimmed;
    }

    private String relative(String remotePath) {
        if ("/".equals(root)) {
            return remotePath;
        }
        return remotePath.startsWith(root) ? remotePath.substring(root.length()) : remotePath;
    }

    private static HttpResponseStatus statusOf(RemoteException e) {
        return switch (e.getErrorCode()) {
            case RemoteException.NOT_FOUND -> HttpResponseStatus.NOT_FOUND;
            case RemoteException.PERMISSION_DENIED -> HttpResponseStatus.FORBIDDEN;
            case RemoteException.INVALID_ARGUMENT -> HttpResponseStatus.BAD_REQUEST;
            default -> HttpResponseStatus.BAD_GATEWAY;
        };
    }

    private void sendResponse(ChannelHandlerContext ctx, HttpRequest request, HttpResponseStatus status,
            String message, String contentType) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(message, StandardCharsets.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        ChannelFuture future = ctx.writeAndFlush(response);
        if (!HttpUtil.isKeepAlive(request)) {
            future.addListener(ChannelFutureListener.CLOSE);
        }
    }

    private void sendError(ChannelHandlerContext ctx, HttpResponseStatus status) {
        sendError(ctx, status, status.reasonPhrase());
    }

    private void sendError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer("Error: " + message, StandardCharsets.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("Exception caught while processing request", cause);
        if (ctx.channel().isActive()) {
            sendError(ctx, HttpResponseStatus.INTERNAL_SERVER_ERROR, String.valueOf(cause.getMessage()));
        }
        ctx.close();
    }
}
