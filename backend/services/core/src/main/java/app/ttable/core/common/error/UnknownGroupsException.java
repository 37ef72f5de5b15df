package app.ttable.core.common.error;

import java.util.List;

public class UnknownGroupsException extends TimetableException {

    private final List<String> groupNames;

    public UnknownGroupsException(List<String> groupNames) {
        super(ErrorKind.validation, "Groups not found or inactive: " + groupNames);
        this.groupNames = List.copyOf(groupNames);
    }

    public List<String> getGroupNames() {
        return groupNames;
    }
}
