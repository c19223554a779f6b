package com.codeheadsystems.jwtdown.springboot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "jwtdown")
public class JwtdownProperties {

  private String secretKey = "";
  private String algorithm = "HS256";
  private long accessTokenExpireMinutes = 30;
  private boolean enforceExpiry = false;
  private String cookieName = "jwtdown_access_token";
  private String developmentOriginMarker = "localhost";
  private String developmentSameSite = "Lax";
  private String crossSiteSameSite = "None";
  private int bcryptCost = 12;

  public String getSecretKey() {
    return secretKey;
  }

  public void setSecretKey(String secretKey) {
    this.secretKey = secretKey;
  }

  public String getAlgorithm() {
    return algorithm;
  }

  public void setAlgorithm(String algorithm) {
    this.algorithm = algorithm;
  }

  public long getAccessTokenExpireMinutes() {
    return accessTokenExpireMinutes;
  }

  public void setAccessTokenExpireMinutes(long accessTokenExpireMinutes) {
    this.accessTokenExpireMinutes = accessTokenExpireMinutes;
  }

  public boolean isEnforceExpiry() {
    return enforceExpiry;
  }

  public void setEnforceExpiry(boolean enforceExpiry) {
    this.enforceExpiry = enforceExpiry;
  }

  public String getCookieName() {
    return cookieName;
  }

  public void setCookieName(String cookieName) {
    this.cookieName = cookieName;
  }

  public String getDevelopmentOriginMarker() {
    return developmentOriginMarker;
  }

  public void setDevelopmentOriginMarker(String developmentOriginMarker) {
    this.developmentOriginMarker = developmentOriginMarker;
  }

  public String getDevelopmentSameSite() {
    return developmentSameSite;
  }

  public void setDevelopmentSameSite(String developmentSameSite) {
    this.developmentSameSite = developmentSameSite;
  }

  public String getCrossSiteSameSite() {
    return crossSiteSameSite;
  }

  public void setCrossSiteSameSite(String crossSiteSameSite) {
    this.crossSiteSameSite = crossSiteSameSite;
  }

  public int getBcryptCost() {
    return bcryptCost;
  }

  public void setBcryptCost(int bcryptCost) {
    this.bcryptCost = bcryptCost;
  }
}
