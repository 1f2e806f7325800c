package uk.gov.di.oidcop.shared.entity;

import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

public class ClientRegistry {

    @Expose
    @SerializedName("client_id")
    private String clientID;

    @Expose
    @SerializedName("redirect_uris")
    private List<String> redirectUrls = new ArrayList<>();

    @Expose private String sectorIdentifierUri;
    @Expose private String userinfoSignedResponseAlg;

    public String getClientID() {
        return clientID;
    }

    public ClientRegistry withClientID(String clientID) {
        this.clientID = clientID;
        return this;
    }

    public List<String> getRedirectUrls() {
        return redirectUrls;
    }

    public ClientRegistry withRedirectUrls(List<String> redirectUrls) {
        this.redirectUrls = redirectUrls;
        return this;
    }

    public String getSectorIdentifierUri() {
        return sectorIdentifierUri;
    }

    public ClientRegistry withSectorIdentifierUri(String sectorIdentifierUri) {
        this.sectorIdentifierUri = sectorIdentifierUri;
        return this;
    }

    public String getUserinfoSignedResponseAlg() {
        return userinfoSignedResponseAlg;
    }

    public ClientRegistry withUserinfoSignedResponseAlg(String userinfoSignedResponseAlg) {
        this.userinfoSignedResponseAlg = userinfoSignedResponseAlg;
        return this;
    }
}
