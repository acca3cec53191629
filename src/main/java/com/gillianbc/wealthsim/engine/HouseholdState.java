package com.gillianbc.wealthsim.engine;

import com.gillianbc.wealthsim.model.Asset;
import com.gillianbc.wealthsim.model.AssetType;
import lombok.Getter;

import java.util.List;

/**
 * Mutable household position for one path, threaded from year to year by the engine.
 * CASH assets are pooled into {@link #getCash()}; their slots in the balance array stay at zero.
 */
@Getter
public final class HouseholdState {

    private final List<Asset> assets;
    private final double[] balances;
    private final double[] costBasis;
    private final boolean[] retired;
    private double cash;
    private double mortgageBalance;

    private HouseholdState(List<Asset> assets, double[] balances, double[] costBasis, int people,
                           double cash, double mortgageBalance) {
        this.assets = assets;
        this.balances = balances;
        this.costBasis = costBasis;
        this.retired = new boolean[people];
        this.cash = cash;
        this.mortgageBalance = mortgageBalance;
    }

    public static HouseholdState initial(SimulationPlan plan) {
        List<Asset> assets = plan.getAssets();
        double[] balances = new double[assets.size()];
        double[] costBasis = new double[assets.size()];
        double cash = 0.0;
        for (int i = 0; i < assets.size(); i++) {
            Asset asset = assets.get(i);
            if (asset.getType() == AssetType.CASH) {
                cash += asset.getBalance();
            } else {
                balances[i] = asset.getBalance();
                costBasis[i] = asset.openingCostBasis();
            }
        }
        double mortgage = plan.getMortgage() != null ? plan.getMortgage().getBalance() : 0.0;
        return new HouseholdState(assets, balances, costBasis, plan.getPeople().size(), cash, mortgage);
    }

    public double balanceOf(String assetId) {
        for (int i = 0; i < assets.size(); i++) {
            if (assets.get(i).getId().equals(assetId)) {
                return assets.get(i).getType() == AssetType.CASH ? 0.0 : balances[i];
            }
        }
        throw new IllegalArgumentException("Unknown asset id " + assetId);
    }

    public boolean isRetired(int person) {
        return retired[person];
    }

    void setRetired(int person, boolean value) {
        retired[person] = value;
    }

    void setCash(double cash) {
        this.cash = cash;
    }

    void setMortgageBalance(double mortgageBalance) {
        this.mortgageBalance = mortgageBalance;
    }

    double sumBalances(AssetType type) {
        double total = 0.0;
        for (int i = 0; i < assets.size(); i++) {
            if (assets.get(i).getType() == type) {
                total += balances[i];
            }
        }
        return total;
    }
}
