package dev.py2flow.analyzer;

import dev.py2flow.model.StepType;
import dev.py2flow.model.SubStep;
import dev.py2flow.python.PyExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * scikit-learn rows of the idiom table: estimator construction, fitting,
 * scoring, transformers and metric functions.
 */
final class SklearnIdioms {

    private SklearnIdioms() {}

    static void register(IdiomTable table) {
        table.add(new Idiom("estimator-constructor", OperationTag.BIND, SklearnIdioms::isConstructor,
            SklearnIdioms::constructor));
        table.add(new Idiom("transformer-fit", OperationTag.BIND,
            site -> isTransformer(site) && site.isMethod("fit"),
            site -> Idiom.Match.passthrough(site, 1)));
        table.add(new Idiom("transformer-apply", OperationTag.DERIVE_COLUMN,
            site -> isTransformer(site) && site.isMethod("fit_transform", "transform"),
            SklearnIdioms::transform));
        table.add(new Idiom("estimator-fit", OperationTag.MODEL_FIT,
            site -> isEstimator(site) && site.isMethod("fit", "fit_predict"), SklearnIdioms::fit));
        table.add(new Idiom("estimator-predict", OperationTag.MODEL_APPLY,
            site -> site.onKind(SymbolTable.Kind.MODEL) && site.isMethodIn(SklearnCatalog.SCORE_METHODS),
            SklearnIdioms::predict));
        table.add(new Idiom("estimator-score", OperationTag.MODEL_APPLY,
            site -> site.onKind(SymbolTable.Kind.MODEL) && site.isMethod("score"), SklearnIdioms::score));
        table.add(new Idiom("metric", OperationTag.MODEL_APPLY,
            site -> site.function() != null && SklearnCatalog.isMetric(site.function()), SklearnIdioms::metric));
    }

    private static boolean isEstimator(IdiomSite site) {
        return site.onKind(SymbolTable.Kind.ESTIMATOR) || site.onKind(SymbolTable.Kind.MODEL);
    }

    private static boolean isTransformer(IdiomSite site) {
        return isEstimator(site) && site.receiver().detail() != null
            && SklearnCatalog.isTransformer(site.receiver().detail());
    }

    private static boolean isConstructor(IdiomSite site) {
        String function = site.function();
        if (function == null || !(site.link() instanceof Chain.Link.FunctionCall
                || site.link() instanceof Chain.Link.MethodCall)) {
            return false;
        }
        return SklearnCatalog.isEstimatorClass(function) || SklearnCatalog.simpleName(function).equals("make_pipeline");
    }

    private static Idiom.Match constructor(IdiomSite site) {
        String variable = site.isLast(1) ? site.target() : site.temporary();
        var value = new Idiom.Value(variable, SymbolTable.Kind.ESTIMATOR, site.functionName());
        return new Idiom.Match(List.of(), 1, value);
    }

    private static Idiom.Match transform(IdiomSite site) {
        PyExpr.Call call = site.call();
        String input = site.frame(call.argument(0, "X"));
        if (input == null) {
            return null;
        }
        String estimator = site.receiver().detail();
        StepType type = SklearnCatalog.isEncoder(estimator) ? StepType.CATEGORICAL_ENCODER : StepType.NORMALIZER;
        var step = new SubStep(type, List.of(), Map.of("method", SklearnCatalog.transformerMethod(estimator),
            "estimator", estimator), null);
        return Idiom.Match.frame(new Operation.DeriveColumn(site.origin(), input, site.output(1), step), 1);
    }

    private static Idiom.Match fit(IdiomSite site) {
        List<String> sources = site.frameArguments(site.call());
        if (sources.isEmpty()) {
            return null;
        }
        String model = site.receiverVariable() != null ? site.receiverVariable() : site.temporary();
        String algorithm = site.receiver().detail();
        var fit = new Operation.ModelFit(site.origin(), sources, model, algorithm);
        var trained = new Idiom.Value(model, SymbolTable.Kind.MODEL, algorithm);
        if (site.method().equals("fit")) {
            return new Idiom.Match(List.of(fit), 1, trained);
        }
        var apply = new Operation.ModelApply(site.origin(), Operation.ApplyMode.SCORE, model, List.of(sources.get(0)),
            site.output(1), "fit_predict");
        return Idiom.Match.frames(List.of(fit, apply), 1);
    }

    private static Idiom.Match predict(IdiomSite site) {
        List<String> sources = site.frameArguments(site.call());
        if (sources.isEmpty()) {
            return null;
        }
        return Idiom.Match.frame(new Operation.ModelApply(site.origin(), Operation.ApplyMode.SCORE,
            site.receiverVariable(), sources, site.output(1), site.method()), 1);
    }

    private static Idiom.Match score(IdiomSite site) {
        List<String> sources = site.frameArguments(site.call());
        if (sources.isEmpty()) {
            return null;
        }
        return Idiom.Match.frame(new Operation.ModelApply(site.origin(), Operation.ApplyMode.EVALUATE,
            site.receiverVariable(), sources, site.output(1), "score"), 1);
    }

    private static Idiom.Match metric(IdiomSite site) {
        PyExpr.Call call = site.call();
        String model = null;
        List<PyExpr> dataArguments = new ArrayList<>();
        for (PyExpr arg : call.args()) {
            if (arg instanceof PyExpr.Name name && site.symbols().is(name.id(), SymbolTable.Kind.MODEL)) {
                model = model == null ? name.id() : model;
            } else {
                dataArguments.add(arg);
            }
        }
        List<String> sources = new ArrayList<>();
        for (PyExpr arg : dataArguments) {
            String frame = site.frame(arg);
            if (frame != null) {
                sources.add(frame);
            }
        }
        if (sources.isEmpty() && model == null) {
            return null;
        }
        return Idiom.Match.frame(new Operation.ModelApply(site.origin(), Operation.ApplyMode.EVALUATE, model, sources,
            site.output(1), site.functionName()), 1);
    }
}
