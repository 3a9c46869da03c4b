package dev.py2flow.analyzer;

import java.util.Map;
import java.util.Set;

/**
 * scikit-learn names recognized by the analyzer.
 */
final class SklearnCatalog {

    /** Preprocessing transformers mapped to the prepare processor parameters they become. */
    private static final Map<String, String> TRANSFORMERS = Map.ofEntries(
        Map.entry("StandardScaler", "standard"),
        Map.entry("MinMaxScaler", "min_max"),
        Map.entry("RobustScaler", "robust"),
        Map.entry("MaxAbsScaler", "max_abs"),
        Map.entry("Normalizer", "normalize"),
        Map.entry("SimpleImputer", "impute"),
        Map.entry("KNNImputer", "impute"),
        Map.entry("PolynomialFeatures", "polynomial"),
        Map.entry("LabelEncoder", "label_encode"),
        Map.entry("OneHotEncoder", "one_hot"),
        Map.entry("OrdinalEncoder", "ordinal"),
        Map.entry("PCA", "pca"));

    private static final Set<String> ENCODERS = Set.of("LabelEncoder", "OneHotEncoder", "OrdinalEncoder");

    private static final Set<String> ESTIMATOR_SUFFIXES = Set.of(
        "Classifier", "Regressor", "Regression", "Clustering", "Pipeline", "SVC", "SVR", "KMeans",
        "DBSCAN", "NB", "Lasso", "Ridge", "ElasticNet");

    private static final Set<String> METRICS = Set.of(
        "accuracy_score", "precision_score", "recall_score", "f1_score", "roc_auc_score", "log_loss",
        "mean_squared_error", "mean_absolute_error", "r2_score", "confusion_matrix",
        "classification_report", "explained_variance_score", "cross_val_score", "silhouette_score");

    static final Set<String> SCORE_METHODS = Set.of("predict", "predict_proba", "decision_function", "predict_log_proba");

    private SklearnCatalog() {}

    static boolean isTransformer(String className) {
        return TRANSFORMERS.containsKey(className);
    }

    static String transformerMethod(String className) {
        return TRANSFORMERS.get(className);
    }

    static boolean isEncoder(String className) {
        return ENCODERS.contains(className);
    }

    /** True for class names that look like models or transformers. */
    static boolean isEstimatorClass(String qualifiedName) {
        String simple = simpleName(qualifiedName);
        if (isTransformer(simple) || qualifiedName.startsWith("sklearn.") || qualifiedName.startsWith("xgboost.")
                || qualifiedName.startsWith("lightgbm.")) {
            return Character.isUpperCase(simple.isEmpty() ? 'x' : simple.charAt(0));
        }
        return ESTIMATOR_SUFFIXES.stream().anyMatch(simple::endsWith);
    }

    static boolean isMetric(String qualifiedName) {
        return METRICS.contains(simpleName(qualifiedName));
    }

    static boolean isSplit(String qualifiedName) {
        return simpleName(qualifiedName).equals("train_test_split");
    }

    static String simpleName(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1);
    }
}
