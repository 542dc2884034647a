package server;

/** A connect attempt while every slot is taken. */
public class ServerFullException extends Exception {
    public static final String REASON = "Server is full";

    public ServerFullException(int capacity) {
        super(REASON + " (" + capacity + " players)");
    }
}
