package zoho.contacts.app.entity;

import lombok.Data;

@Data
public class PaginationCursor {
    private int startIndex;
    private final int pageSize;
    private Integer totalKnown;
    private int processedCount;

    public PaginationCursor(int pageSize) {
        this.pageSize = pageSize;
    }

    public void advance(int fetched) {
        processedCount += fetched;
        startIndex += pageSize;
    }
}
