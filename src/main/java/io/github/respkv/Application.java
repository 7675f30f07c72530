package io.github.respkv;

import java.io.IOException;
import java.net.InetSocketAddress;

import com.google.common.primitives.Ints;
import io.github.respkv.kv.KeyValueStore;
import io.github.respkv.server.KeyValueServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 进程入口：{@code java -jar respkv.jar [--port <port>]}，默认端口6377，只监听本机地址。
 * 数据只在内存中，进程退出即丢失。
 */
public class Application {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    static final int    DEFAULT_PORT = 6377;
    static final String HOST         = "127.0.0.1";
    static final String USAGE        = "usage: respkv [--port <1-65535>]";

    public static void main(String[] args) throws Exception {
        int port;
        try {
            port = getPort(args);
        } catch (IllegalArgumentException e) {
            logger.error("{}. {}", e.getMessage(), USAGE);
            System.exit(2);
            return;
        }

        KeyValueStore store = new KeyValueStore();
        KeyValueServer server = KeyValueServer.builder()
                .socketAddress(new InetSocketAddress(HOST, port))
                .store(store)
                .build();
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("服务进程退出.");
            try {
                server.shutdown();
            } catch (IOException e) {
                logger.error("shutdown kv server failed.", e);
            }
        }));
        server.awaitTermination();
    }

    /**
     * 解析命令行参数，支持 {@code --port 6380} 和 {@code --port=6380}。
     *
     * @param args 命令行参数
     * @return 端口，没有指定时返回{@link #DEFAULT_PORT}
     * @throws IllegalArgumentException 未知参数、缺少端口值或者端口不合法
     */
    static int getPort(String[] args) {
        int port = DEFAULT_PORT;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String value;
            if (arg.equals("--port")) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for --port");
                }
                value = args[++i];
            } else if (arg.startsWith("--port=")) {
                value = arg.substring("--port=".length());
            } else {
                throw new IllegalArgumentException("unknown argument: " + arg);
            }
            port = parsePort(value);
        }
        return port;
    }

    private static int parsePort(String value) {
        Integer port = Ints.tryParse(value);
        if (port == null || port < 1 || port > 65535) {
            throw new IllegalArgumentException("invalid port: " + value);
        }
        return port;
    }
}
