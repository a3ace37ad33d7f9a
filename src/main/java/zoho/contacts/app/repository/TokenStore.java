package zoho.contacts.app.repository;

import zoho.contacts.app.entity.Credential;

import java.util.Optional;

/**
 * Persistence for the single OAuth credential of this installation.
 * Absent or corrupt storage loads as empty.
 */
public interface TokenStore {
    Optional<Credential> load();

    void save(Credential credential);
}
