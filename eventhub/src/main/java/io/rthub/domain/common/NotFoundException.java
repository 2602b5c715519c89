package io.rthub.domain.common;

public class NotFoundException extends EventHubException {

    private final String entity;
    private final String id;

    public NotFoundException(String entity, String id) {
        super(404, String.format("%s %s not found", entity, id));
        this.entity = entity;
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public String getId() {
        return id;
    }
}
