package com.ninesync.imap;

import com.ninesync.domain.CapabilitySet;
import lombok.Getter;

/**
 * IMAP session context
 * State for a single client connection. The selected folder is non-null
 * exactly when the state is SELECTED.
 */
@Getter
public class ImapSession {

    private ImapState state = ImapState.DISCONNECTED;
    private String selectedFolder;
    private boolean readOnly = false; // true when opened with EXAMINE
    private boolean tlsActive = false;
    private CapabilitySet capabilities = CapabilitySet.empty();

    /**
     * Greeting received (PREAUTH skips straight to AUTHENTICATED)
     */
    public void connected(boolean preAuthenticated) {
        this.selectedFolder = null;
        this.readOnly = false;
        this.state = preAuthenticated ? ImapState.AUTHENTICATED : ImapState.CONNECTED;
    }

    public void authenticated() {
        this.selectedFolder = null;
        this.readOnly = false;
        this.state = ImapState.AUTHENTICATED;
    }

    /**
     * Select mailbox (SELECT/EXAMINE)
     */
    public void selectMailbox(String folder, boolean readOnly) {
        this.selectedFolder = folder;
        this.readOnly = readOnly;
        this.state = ImapState.SELECTED;
    }

    /**
     * Close mailbox
     */
    public void closeMailbox() {
        this.selectedFolder = null;
        this.readOnly = false;
        this.state = ImapState.AUTHENTICATED;
    }

    /**
     * Back to DISCONNECTED from any state
     */
    public void disconnected() {
        this.selectedFolder = null;
        this.readOnly = false;
        this.tlsActive = false;
        this.capabilities = CapabilitySet.empty();
        this.state = ImapState.DISCONNECTED;
    }

    public void setTlsActive(boolean tlsActive) {
        this.tlsActive = tlsActive;
    }

    public void setCapabilities(CapabilitySet capabilities) {
        this.capabilities = capabilities == null ? CapabilitySet.empty() : capabilities;
    }

    public boolean isSelected(String folder) {
        return state == ImapState.SELECTED && selectedFolder != null && selectedFolder.equals(folder);
    }
}
