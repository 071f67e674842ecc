package sensormonitor.output;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sensormonitor.domain.DashboardFrame;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Socket.IO server that broadcasts every frame to connected browser dashboards
 * as a {@value #SNAPSHOT_EVENT} event carrying the frame's JSON.
 */
public class SocketIOSnapshotOutput implements TelemetryOutput {
    private static final Logger logger = LoggerFactory.getLogger(SocketIOSnapshotOutput.class);

    public static final String SNAPSHOT_EVENT = "snapshot";

    private final String hostname;
    private final int port;
    private final AtomicInteger connectedClients = new AtomicInteger(0);

    private volatile SocketIOServer server;

    /**
     * Create a dashboard server listening on all interfaces.
     *
     * @param port the server port
     */
    public SocketIOSnapshotOutput(int port) {
        this("0.0.0.0", port);
    }

    public SocketIOSnapshotOutput(String hostname, int port) {
        this.hostname = hostname;
        this.port = port;
    }

    @Override
    public void initialize() {
        if (server != null) {
            return;
        }
        Configuration config = new Configuration();
        config.setHostname(hostname);
        config.setPort(port);
        config.setOrigin("*");
        config.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        config.setPingTimeout(60000);
        config.setPingInterval(25000);

        SocketIOServer created = new SocketIOServer(config);
        created.addConnectListener(client -> {
            int count = connectedClients.incrementAndGet();
            logger.info("Dashboard connected: {} (Total connections: {})", client.getSessionId(), count);
        });
        created.addDisconnectListener(client -> {
            int count = connectedClients.decrementAndGet();
            logger.info("Dashboard disconnected: {} (Total connections: {})", client.getSessionId(), count);
        });
        created.start();
        server = created;

        logger.info("Dashboard Socket.IO server listening on {}:{}", hostname, port);
    }

    @Override
    public void send(DashboardFrame frame) {
        SocketIOServer current = server;
        if (current == null) {
            throw new IllegalStateException("Dashboard server is not initialized");
        }
        current.getBroadcastOperations().sendEvent(SNAPSHOT_EVENT, frame.toJSON());
    }

    @Override
    public void close() {
        SocketIOServer current = server;
        server = null;
        if (current != null) {
            current.stop();
            logger.info("Dashboard Socket.IO server stopped");
        }
    }

    public int getConnectedClients() {
        return connectedClients.get();
    }
}
