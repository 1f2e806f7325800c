package uk.gov.di.oidcop.shared.entity;

public class AuthenticationEvent {

    private final String acr;
    private final long authnTime;
    private volatile long validUntil;

    public AuthenticationEvent(String acr, long authnTime, long validUntil) {
        this.acr = acr;
        this.authnTime = authnTime;
        this.validUntil = validUntil;
    }

    public static AuthenticationEvent create(String acr, long authnTime, long lifetime) {
        return new AuthenticationEvent(acr, authnTime, authnTime + lifetime);
    }

    public String getAcr() {
        return acr;
    }

    public long getAuthnTime() {
        return authnTime;
    }

    public long getValidUntil() {
        return validUntil;
    }

    public void extendUntil(long validUntil) {
        this.validUntil = validUntil;
    }

    public boolean isValid(long now) {
        return now < validUntil;
    }
}
