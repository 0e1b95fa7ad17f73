package api.impl.handlers;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import domain.interfaces.ICoachService;
import infrastructure.gsi.SnapshotParser;

public class HandlerFactory implements IHandlerFactory {

    private final ICoachService service;
    private final SnapshotParser parser;

    public HandlerFactory(ICoachService service) { this(service, new SnapshotParser()); }

    public HandlerFactory(ICoachService service, SnapshotParser parser) {
        this.service = service;
        this.parser = parser;
    }

    @Override
    public IHttpHandler route(HttpRequest req) {
        String m = req.method();
        String p = req.path();

        // the game client posts to whatever URI its cfg names, so any path is accepted
        if ("POST".equals(m)) return new GameStateHandler(service, parser);

        if ("GET".equals(m)) {
            if ("/insights".equals(p)) return new InsightsHandler(service);
            if ("/health".equals(p)) return new HealthHandler(service);
        }
        return new NotFoundHandler();
    }
}
