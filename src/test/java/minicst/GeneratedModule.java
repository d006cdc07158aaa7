package minicst;

import minicst.ast.Module;

class GeneratedModule {
  final Module module;

  GeneratedModule(Module module) {
    this.module = module;
  }

  @Override
  public String toString() {
    return module.code();
  }
}
