package zoho.contacts.app.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MailFolder {
    private String folderId;
    private String folderName;
    private boolean systemFolder;
}
