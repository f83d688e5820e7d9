package com.example.appendagetransfer.error;

import java.util.List;

/**
 * Frame files that look like one image sequence disagree on padding or extension.
 * Reported as a diagnostic; the members are transferred as independent files.
 */
public class AmbiguousSequenceException extends ArchiveException {
    private final String sequenceName;
    private final List<String> members;

    public AmbiguousSequenceException(String sequenceName, List<String> members, String reason) {
        super("Ambiguous image sequence '" + sequenceName + "' (" + members.size() + " files): " + reason);
        this.sequenceName = sequenceName;
        this.members = List.copyOf(members);
    }

    public String getSequenceName() {
        return sequenceName;
    }

    public List<String> getMembers() {
        return members;
    }
}
