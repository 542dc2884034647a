package server;

/** Why a session ended. All of them go through the same cleanup. */
public enum DisconnectReason {
    CLIENT_CLOSED,
    CONNECTION_LOST,
    TIMEOUT,
    SEND_FAILED,
    PROTOCOL_ERROR,
    SHUTDOWN
}
