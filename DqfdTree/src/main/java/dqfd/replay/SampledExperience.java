package dqfd.replay;

// An experience handed out by a draw, with its importance-sampling weight.
public class SampledExperience {
    public final Experience experience;
    public final double weight;

    public SampledExperience(Experience experience, double weight) {
        this.experience = experience;
        this.weight = weight;
    }
}
