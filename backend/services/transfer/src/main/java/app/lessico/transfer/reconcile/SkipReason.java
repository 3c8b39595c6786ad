package app.lessico.transfer.reconcile;

public enum SkipReason {
    duplicate,
    missing_id,
    missing_natural_key,
    missing_translation,
    no_matching_word,
    not_an_object
}
