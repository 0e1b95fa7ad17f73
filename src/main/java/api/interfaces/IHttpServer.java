package api.interfaces;

/*
AutoCloseable lets tests and the shutdown hook stop the listener
 */
public interface IHttpServer extends AutoCloseable {
    void start() throws Exception;
    int port();
    @Override void close() throws Exception;
}
