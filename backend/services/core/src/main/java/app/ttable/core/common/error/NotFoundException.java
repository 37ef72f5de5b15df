package app.ttable.core.common.error;

public class NotFoundException extends TimetableException {

    private final String entity;
    private final Object id;

    public NotFoundException(String entity, Object id) {
        super(ErrorKind.not_found, entity + " not found: " + id);
        this.entity = entity;
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public Object getId() {
        return id;
    }
}
