package io.b2mash.shopdesk.routing;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.shopdesk.TestSessions;
import org.junit.jupiter.api.Test;

class RouteClassifierTest {

  private final RouteClassifier classifier = new RouteClassifier(TestSessions.routeProperties());

  @Test
  void protectedPrefix_matchesExactAndNestedPaths() {
    assertThat(classifier.classify("/dashboard")).isEqualTo(RouteClass.PROTECTED);
    assertThat(classifier.classify("/dashboard/sales/today")).isEqualTo(RouteClass.PROTECTED);
    assertThat(classifier.classify("/account_settings")).isEqualTo(RouteClass.PROTECTED);
    assertThat(classifier.classify("/bills/42")).isEqualTo(RouteClass.PROTECTED);
  }

  @Test
  void protectedPrefix_doesNotMatchLongerSegment() {
    assertThat(classifier.classify("/dashboards")).isEqualTo(RouteClass.PUBLIC);
    assertThat(classifier.classify("/settingsx/a")).isEqualTo(RouteClass.PUBLIC);
  }

  @Test
  void authOnlyPaths_matchExactly() {
    assertThat(classifier.classify("/login")).isEqualTo(RouteClass.AUTH_ONLY);
    assertThat(classifier.classify("/signup")).isEqualTo(RouteClass.AUTH_ONLY);
    assertThat(classifier.classify("/login/help")).isEqualTo(RouteClass.PUBLIC);
  }

  @Test
  void matching_isCaseSensitive() {
    assertThat(classifier.classify("/Dashboard")).isEqualTo(RouteClass.PUBLIC);
    assertThat(classifier.classify("/LOGIN")).isEqualTo(RouteClass.PUBLIC);
  }

  @Test
  void staticAssets_arePublicEvenUnderProtectedPrefix() {
    assertThat(classifier.classify("/dashboard/logo.png")).isEqualTo(RouteClass.PUBLIC);
    assertThat(classifier.classify("/_next/static/chunks/app.js")).isEqualTo(RouteClass.PUBLIC);
    assertThat(classifier.classify("/favicon.ico")).isEqualTo(RouteClass.PUBLIC);
    assertThat(classifier.isStaticAsset("/images/HERO.WEBP")).isTrue();
    assertThat(classifier.isStaticAsset("/fonts/inter.woff2")).isTrue();
  }

  @Test
  void emptyOrMissingPath_isPublic() {
    assertThat(classifier.classify("")).isEqualTo(RouteClass.PUBLIC);
    assertThat(classifier.classify(null)).isEqualTo(RouteClass.PUBLIC);
    assertThat(classifier.classify("/")).isEqualTo(RouteClass.PUBLIC);
  }
}
