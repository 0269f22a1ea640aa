package com.enterpriseagent.core.validation;

import com.enterpriseagent.core.model.Domain;
import org.springframework.stereotype.Component;

/**
 * Maps each {@link Domain} to its check. The switch is exhaustive, so adding a
 * domain without a validator does not compile.
 */
@Component
public class DomainValidators {

    private final CodingValidator coding;
    private final SocialMediaValidator socialMedia;
    private final ContentValidator content;
    private final TradingValidator trading;
    private final RealEstateValidator realEstate;

    public DomainValidators(CodingValidator coding,
                            SocialMediaValidator socialMedia,
                            ContentValidator content,
                            TradingValidator trading,
                            RealEstateValidator realEstate) {
        this.coding = coding;
        this.socialMedia = socialMedia;
        this.content = content;
        this.trading = trading;
        this.realEstate = realEstate;
    }

    public DomainValidator forDomain(Domain domain) {
        return switch (domain) {
            case CODING -> coding;
            case SOCIAL_MEDIA -> socialMedia;
            case CONTENT -> content;
            case TRADING -> trading;
            case REAL_ESTATE -> realEstate;
        };
    }
}
