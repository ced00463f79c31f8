package pooled.treasury.domain.model.record;

public enum RecordKind {
  ACTION("action"),
  PROPOSAL("proposal");

  private final String label;

  RecordKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
