package ca.gc.cra.beacon.domain.packet;

/**
 * Source languages understood by the console's highlighting viewers.
 *
 * @since 0.1.0
 */
public enum SourceId {
  HTML(ViewerId.HTML_SOURCE),
  JAVASCRIPT(ViewerId.JAVASCRIPT_SOURCE),
  VBSCRIPT(ViewerId.VBSCRIPT_SOURCE),
  PERL(ViewerId.PERL_SOURCE),
  SQL(ViewerId.SQL_SOURCE),
  INI(ViewerId.INI_SOURCE),
  PYTHON(ViewerId.PYTHON_SOURCE),
  XML(ViewerId.XML_SOURCE);

  private final ViewerId viewer;

  SourceId(ViewerId viewer) {
    this.viewer = viewer;
  }

  /**
   * Returns the viewer that renders this source type.
   *
   * @return viewer id
   */
  public ViewerId viewer() {
    return viewer;
  }
}
