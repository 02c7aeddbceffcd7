package com.ryuqq.moderation.application.model;

import com.ryuqq.moderation.core.model.Item;
import com.ryuqq.moderation.core.model.Prediction;
import com.ryuqq.moderation.core.spi.ModerationModel;

/**
 * 로지스틱 회귀 기반 모더레이션 모델.
 *
 * <p><strong>특징 정규화:</strong></p>
 * <pre>
 * x = [ verified ? 1 : 0,
 *       min(imagesQty / 10, 1),
 *       min(len(description) / 1000, 1),
 *       category / 100 ]
 * probability = sigmoid(w · x + b)
 * violation   = probability ≥ threshold
 * </pre>
 *
 * <p>가중치는 생성 시점에 고정되며 이후 변경되지 않습니다. 상태가 없으므로
 * 모든 Worker가 하나의 인스턴스를 동시에 호출해도 안전합니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public final class LogisticModerationModel implements ModerationModel {

    private final ModelWeights weights;

    public LogisticModerationModel() {
        this(ModelWeights.DEFAULT);
    }

    public LogisticModerationModel(ModelWeights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("weights cannot be null");
        }
        this.weights = weights;
    }

    @Override
    public Prediction predict(Item item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        double[] x = features(item);
        double z = weights.bias()
            + weights.verifiedSeller() * x[0]
            + weights.imagesQty() * x[1]
            + weights.descriptionLength() * x[2]
            + weights.category() * x[3];
        double probability = 1.0 / (1.0 + Math.exp(-z));
        return Prediction.of(probability >= weights.threshold(), probability);
    }

    /**
     * 정규화된 특징 벡터.
     *
     * @param item 아이템
     * @return [verified, images, descriptionLength, category]
     */
    static double[] features(Item item) {
        return new double[] {
            item.sellerVerified() ? 1.0 : 0.0,
            Math.min(item.imagesQty() / 10.0, 1.0),
            Math.min(item.description().length() / 1000.0, 1.0),
            item.category() / 100.0
        };
    }

    public ModelWeights getWeights() {
        return weights;
    }
}
