package br.edu.ifba.deduper.bucket;

import br.edu.ifba.deduper.core.FileRecord;
import br.edu.ifba.deduper.core.MediaType;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Files with identical checksum and size: confirmed duplicates.
 *
 * @param mediaType shared media type
 * @param checksum shared checksum
 * @param members at least two records, sorted by id
 */
public record ChecksumGroup(
    @NotNull MediaType mediaType,
    @NotNull String checksum,
    @NotNull List<FileRecord> members
) {

    public ChecksumGroup {
        if (members == null || members.size() < 2) {
            throw new IllegalArgumentException("a checksum group needs at least two members");
        }
        members = List.copyOf(members);
    }

    /**
     * Member kept in hash-based bucketing on behalf of the whole group.
     */
    public FileRecord representative() {
        return members.get(0);
    }
}
